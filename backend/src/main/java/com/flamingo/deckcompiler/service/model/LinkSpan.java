package com.flamingo.deckcompiler.service.model;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A hyperlink inside a text run.
 *
 * <p>A link targets either a literal address or a slide label. Label links are symbolic until the
 * {@link com.flamingo.deckcompiler.service.reference.ForwardReferenceResolver} calls {@link
 * #resolveTo(int)} once the whole presentation has been built; this is the only mutation the slide
 * tree sees after construction.
 */
public final class LinkSpan implements TextSpan {

  private final String text;
  private final String address;
  private final String label;
  private final String nodePath;
  private Integer targetSlide;

  private LinkSpan(String text, String address, String label, String nodePath) {
    this.text = Objects.requireNonNull(text, "text");
    this.address = address;
    this.label = label;
    this.nodePath = nodePath;
  }

  public static LinkSpan toAddress(String text, String address, String nodePath) {
    return new LinkSpan(text, Objects.requireNonNull(address, "address"), null, nodePath);
  }

  public static LinkSpan toLabel(String text, String label, String nodePath) {
    return new LinkSpan(text, null, Objects.requireNonNull(label, "label"), nodePath);
  }

  public String text() {
    return text;
  }

  public String address() {
    return address;
  }

  public String label() {
    return label;
  }

  public String nodePath() {
    return nodePath;
  }

  public boolean isSymbolic() {
    return label != null;
  }

  public boolean isResolved() {
    return !isSymbolic() || targetSlide != null;
  }

  /** Index of the slide a symbolic link points to, empty for address links or before resolution. */
  public OptionalInt targetSlide() {
    return targetSlide == null ? OptionalInt.empty() : OptionalInt.of(targetSlide);
  }

  /**
   * Binds this symbolic link to a slide.
   *
   * @throws IllegalStateException if the link carries an address or was already resolved
   */
  public void resolveTo(int slideIndex) {
    if (!isSymbolic()) {
      throw new IllegalStateException("Address links need no resolution: " + address);
    }
    if (targetSlide != null) {
      throw new IllegalStateException("Link to label \"" + label + "\" already resolved");
    }
    this.targetSlide = slideIndex;
  }

  @Override
  public String toString() {
    return isSymbolic()
        ? "LinkSpan[text=" + text + ", label=" + label + ", slide=" + targetSlide + "]"
        : "LinkSpan[text=" + text + ", address=" + address + "]";
  }
}
