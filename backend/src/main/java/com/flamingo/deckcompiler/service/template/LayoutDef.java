package com.flamingo.deckcompiler.service.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A slide layout of the template skeleton.
 *
 * @param name layout name, unique within the mapping
 * @param index position of the layout in the skeleton's layout list
 * @param placeholders placeholder name to placeholder index, in declaration order
 */
public record LayoutDef(String name, int index, Map<String, Integer> placeholders) {

  public LayoutDef {
    placeholders = Collections.unmodifiableMap(new LinkedHashMap<>(placeholders));
  }

  public Optional<Integer> placeholderIndex(String placeholderName) {
    return Optional.ofNullable(placeholders.get(placeholderName));
  }
}
