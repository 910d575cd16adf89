package com.flamingo.deckcompiler.service.model;

import com.flamingo.deckcompiler.service.list.ListEntry;
import com.flamingo.deckcompiler.service.list.ListFlattener;
import com.flamingo.deckcompiler.service.list.ListItem;
import java.util.List;
import java.util.stream.Stream;

/** Bulleted list placeholder payload. */
public record ListContent(List<ListItem> items) implements PlaceholderContent {

  public ListContent {
    items = List.copyOf(items);
  }

  @Override
  public PlaceholderKind kind() {
    return PlaceholderKind.LIST;
  }

  /** A fresh single-use stream of leveled entries, see {@link ListFlattener#flatten(List)}. */
  public Stream<ListEntry> entries() {
    return ListFlattener.flatten(items);
  }
}
