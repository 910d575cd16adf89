package com.flamingo.deckcompiler.exception;

/** Exception thrown when a table mixes minimum row mode with explicit row weights. */
public class TableLayoutException extends DeckCompilationException {

  public TableLayoutException(String message, String nodePath) {
    super(CompilationErrorCode.UNSUPPORTED_MIXED_ROW_MODE, message, nodePath);
  }
}
