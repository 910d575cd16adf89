package com.flamingo.deckcompiler.service.model;

import com.flamingo.deckcompiler.service.template.LayoutDef;
import java.util.List;
import java.util.Optional;

/**
 * A slide of the compiled presentation.
 *
 * @param index position in the deck (0-based); links resolve to this value
 * @param layout the layout the slide is created from
 * @param label optional label other slides link to, may be null
 * @param placeholders filled placeholders in document order
 * @param path node path of the {@code <slide>} element
 */
public record SlideNode(
    int index, LayoutDef layout, String label, List<PlaceholderNode> placeholders, String path) {

  public SlideNode {
    placeholders = List.copyOf(placeholders);
  }

  public Optional<String> labelOptional() {
    return Optional.ofNullable(label);
  }

  public Optional<PlaceholderNode> placeholder(String name) {
    return placeholders.stream().filter(p -> p.name().equals(name)).findFirst();
  }
}
