package com.flamingo.deckcompiler.service.list;

import com.flamingo.deckcompiler.service.model.TextRun;
import java.util.List;

/**
 * One bullet of a list together with its nested bullets.
 *
 * @param content the bullet's own text, excluding nested items
 * @param children nested items in document order
 */
public record ListItem(TextRun content, List<ListItem> children) {

  public ListItem {
    children = List.copyOf(children);
  }

  public static ListItem leaf(TextRun content) {
    return new ListItem(content, List.of());
  }
}
