package com.flamingo.deckcompiler.exception;

/** Exception thrown when a placeholder name is not part of the slide's layout. */
public class UnknownPlaceholderException extends DeckCompilationException {

  private final String layoutName;
  private final String placeholderName;

  public UnknownPlaceholderException(String layoutName, String placeholderName, String nodePath) {
    super(
        CompilationErrorCode.UNKNOWN_PLACEHOLDER,
        String.format("Placeholder \"%s\" not found in layout \"%s\"", placeholderName, layoutName),
        nodePath);
    this.layoutName = layoutName;
    this.placeholderName = placeholderName;
  }

  public String getLayoutName() {
    return layoutName;
  }

  public String getPlaceholderName() {
    return placeholderName;
  }
}
