package com.flamingo.deckcompiler.exception;

/** Exception thrown when rows cannot be imported from a CSV or XLSX file. */
public class TabularImportException extends DeckCompilationException {

  public TabularImportException(String message, String nodePath) {
    super(CompilationErrorCode.TABULAR_IMPORT_FAILED, message, nodePath);
  }

  public TabularImportException(String message, String nodePath, Throwable cause) {
    super(CompilationErrorCode.TABULAR_IMPORT_FAILED, message, nodePath, cause);
  }
}
