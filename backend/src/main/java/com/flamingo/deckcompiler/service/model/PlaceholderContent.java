package com.flamingo.deckcompiler.service.model;

/** Typed payload of a placeholder; one variant per {@link PlaceholderKind}. */
public sealed interface PlaceholderContent
    permits TextContent, ImageContent, TableContent, ListContent {

  PlaceholderKind kind();
}
