package com.flamingo.deckcompiler.exception;

/**
 * Base class for every terminal compilation failure.
 *
 * <p>Carries the {@link CompilationErrorCode} and the path of the node being visited when the
 * failure was detected, e.g. {@code /presentation/slide[2]/placeholder[1]}. The path is {@code
 * null} for failures that are not tied to a node.
 */
public abstract class DeckCompilationException extends RuntimeException {

  private final CompilationErrorCode errorCode;
  private final String nodePath;

  protected DeckCompilationException(
      CompilationErrorCode errorCode, String message, String nodePath) {
    super(nodePath == null ? message : message + " (at " + nodePath + ")");
    this.errorCode = errorCode;
    this.nodePath = nodePath;
  }

  protected DeckCompilationException(
      CompilationErrorCode errorCode, String message, String nodePath, Throwable cause) {
    super(nodePath == null ? message : message + " (at " + nodePath + ")", cause);
    this.errorCode = errorCode;
    this.nodePath = nodePath;
  }

  public CompilationErrorCode getErrorCode() {
    return errorCode;
  }

  public String getNodePath() {
    return nodePath;
  }
}
