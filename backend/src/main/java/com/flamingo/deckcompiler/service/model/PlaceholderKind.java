package com.flamingo.deckcompiler.service.model;

import java.util.Locale;
import java.util.Optional;

/** The closed set of payload kinds a placeholder can carry. */
public enum PlaceholderKind {
  TEXT,
  IMAGE,
  TABLE,
  LIST;

  /** Name used for the {@code type} attribute and for the wrapper element, e.g. {@code table}. */
  public String elementName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<PlaceholderKind> fromElementName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (PlaceholderKind kind : values()) {
      if (kind.elementName().equals(name.trim())) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
