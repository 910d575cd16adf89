package com.flamingo.deckcompiler.service.model;

/**
 * Image placeholder payload. The path is not checked here; the writer reports missing images.
 *
 * @param path image file path as written in the document, after variable substitution
 */
public record ImageContent(String path) implements PlaceholderContent {

  @Override
  public PlaceholderKind kind() {
    return PlaceholderKind.IMAGE;
  }
}
