package com.flamingo.deckcompiler.service.list;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Flattens a {@link ListItem} tree into leveled bullets, depth-first.
 *
 * <p>The walk keeps an explicit stack of sibling iterators, so arbitrarily deep lists do not grow
 * the call stack. Entries are produced on demand; the returned stream can be consumed once.
 */
public final class ListFlattener {

  private ListFlattener() {}

  /**
   * Returns the items as a lazy stream of {@code (run, depth)} entries in document order.
   *
   * <p>For {@code a > b > c}, a sibling {@code d} under {@code a}, and a second top-level item
   * {@code e}, the stream yields {@code (a,0) (b,1) (c,2) (d,1) (e,0)}.
   */
  public static Stream<ListEntry> flatten(List<ListItem> items) {
    Iterator<ListEntry> iterator = new DepthFirstIterator(items);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            iterator, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
        false);
  }

  private static final class DepthFirstIterator implements Iterator<ListEntry> {

    private final Deque<Iterator<ListItem>> levels = new ArrayDeque<>();

    DepthFirstIterator(List<ListItem> roots) {
      levels.push(roots.iterator());
    }

    @Override
    public boolean hasNext() {
      while (!levels.isEmpty() && !levels.peek().hasNext()) {
        levels.pop();
      }
      return !levels.isEmpty();
    }

    @Override
    public ListEntry next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int depth = levels.size() - 1;
      ListItem item = levels.peek().next();
      if (!item.children().isEmpty()) {
        levels.push(item.children().iterator());
      }
      return new ListEntry(item.content(), depth);
    }
  }
}
