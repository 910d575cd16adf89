package com.flamingo.deckcompiler.service.model;

import com.flamingo.deckcompiler.service.table.TableLayout;
import com.flamingo.deckcompiler.service.table.TableSpec;

/** Table placeholder payload: the declared table and its computed layout. */
public record TableContent(TableSpec spec, TableLayout layout) implements PlaceholderContent {

  @Override
  public PlaceholderKind kind() {
    return PlaceholderKind.TABLE;
  }
}
