package com.flamingo.deckcompiler.service.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered sequence of {@link TextSpan}s forming the text of a placeholder, cell or list item.
 *
 * @param spans spans in reading order
 */
public record TextRun(List<TextSpan> spans) {

  public static final TextRun EMPTY = new TextRun(List.of());

  public TextRun {
    spans = List.copyOf(spans);
  }

  public static TextRun of(String literal) {
    return literal == null || literal.isEmpty()
        ? EMPTY
        : new TextRun(List.of(new LiteralSpan(literal)));
  }

  public boolean isEmpty() {
    return spans.isEmpty();
  }

  /** {@code true} when every span is literal text. */
  public boolean isPlain() {
    return spans.stream().allMatch(LiteralSpan.class::isInstance);
  }

  /** Concatenated literal and link text; date spans contribute nothing. */
  public String plainText() {
    return spans.stream()
        .map(
            span -> {
              if (span instanceof LiteralSpan literal) {
                return literal.text();
              }
              if (span instanceof LinkSpan link) {
                return link.text();
              }
              return "";
            })
        .collect(Collectors.joining());
  }

  public List<LinkSpan> links() {
    return spans.stream().filter(LinkSpan.class::isInstance).map(LinkSpan.class::cast).toList();
  }
}
