package com.flamingo.deckcompiler.service.model;

/** Text placeholder payload. */
public record TextContent(TextRun run) implements PlaceholderContent {

  @Override
  public PlaceholderKind kind() {
    return PlaceholderKind.TEXT;
  }
}
