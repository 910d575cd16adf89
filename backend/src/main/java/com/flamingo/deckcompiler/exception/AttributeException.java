package com.flamingo.deckcompiler.exception;

/** Exception thrown when an element's attributes are missing or contradict each other. */
public class AttributeException extends DeckCompilationException {

  private final String attributeName;

  private AttributeException(
      CompilationErrorCode errorCode, String attributeName, String message, String nodePath) {
    super(errorCode, message, nodePath);
    this.attributeName = attributeName;
  }

  public static AttributeException missing(String element, String attributeName, String nodePath) {
    return new AttributeException(
        CompilationErrorCode.MISSING_REQUIRED_ATTRIBUTE,
        attributeName,
        String.format("<%s> requires a \"%s\" attribute", element, attributeName),
        nodePath);
  }

  public static AttributeException conflicting(
      String attributeName, String message, String nodePath) {
    return new AttributeException(
        CompilationErrorCode.CONFLICTING_ATTRIBUTE, attributeName, message, nodePath);
  }

  public String getAttributeName() {
    return attributeName;
  }
}
