package com.flamingo.deckcompiler.exception;

/** Exception thrown when slide labels are declared twice or referenced but never declared. */
public class LabelException extends DeckCompilationException {

  private final String label;

  private LabelException(
      CompilationErrorCode errorCode, String label, String message, String nodePath) {
    super(errorCode, message, nodePath);
    this.label = label;
  }

  public static LabelException duplicate(String label, String nodePath) {
    return new LabelException(
        CompilationErrorCode.DUPLICATE_LABEL, label, "Label already declared: " + label, nodePath);
  }

  public static LabelException unresolved(String label, String nodePath) {
    return new LabelException(
        CompilationErrorCode.UNRESOLVED_LABEL,
        label,
        "No slide declares label: " + label,
        nodePath);
  }

  public String getLabel() {
    return label;
  }
}
