package com.flamingo.deckcompiler.exception;

/** Exception thrown when a template mapping document cannot be loaded. */
public class TemplateMappingException extends DeckCompilationException {

  public TemplateMappingException(CompilationErrorCode errorCode, String message, String nodePath) {
    super(errorCode, message, nodePath);
  }

  public TemplateMappingException(String message, Throwable cause) {
    super(CompilationErrorCode.MALFORMED_MAPPING, message, null, cause);
  }

  public static TemplateMappingException malformed(String message, String nodePath) {
    return new TemplateMappingException(CompilationErrorCode.MALFORMED_MAPPING, message, nodePath);
  }
}
