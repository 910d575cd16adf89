package com.flamingo.deckcompiler.exception;

/** Exception thrown when a slide names a layout that the template mapping does not define. */
public class UnknownLayoutException extends DeckCompilationException {

  private final String layoutName;

  public UnknownLayoutException(String layoutName, String nodePath) {
    super(CompilationErrorCode.UNKNOWN_LAYOUT, "Unknown layout: " + layoutName, nodePath);
    this.layoutName = layoutName;
  }

  public String getLayoutName() {
    return layoutName;
  }
}
