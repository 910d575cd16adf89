package com.flamingo.deckcompiler.exception;

/** Exception thrown when the presentation document violates its structure rules. */
public class MalformedDocumentException extends DeckCompilationException {

  public MalformedDocumentException(String message, String nodePath) {
    super(CompilationErrorCode.MALFORMED_DOCUMENT, message, nodePath);
  }

  public MalformedDocumentException(String message, Throwable cause) {
    super(CompilationErrorCode.MALFORMED_DOCUMENT, message, null, cause);
  }

  public MalformedDocumentException(String message, String nodePath, Throwable cause) {
    super(CompilationErrorCode.MALFORMED_DOCUMENT, message, nodePath, cause);
  }
}
