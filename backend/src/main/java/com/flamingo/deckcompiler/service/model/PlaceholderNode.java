package com.flamingo.deckcompiler.service.model;

/**
 * A filled placeholder of a slide.
 *
 * @param name placeholder name from the template mapping
 * @param index placeholder index inside the layout
 * @param content typed payload; its {@link PlaceholderContent#kind()} is the placeholder kind
 * @param path node path of the {@code <placeholder>} element
 */
public record PlaceholderNode(String name, int index, PlaceholderContent content, String path) {

  public PlaceholderKind kind() {
    return content.kind();
  }
}
