package com.flamingo.deckcompiler.service.importer;

import com.flamingo.deckcompiler.exception.TabularImportException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A 1-based selection of rows or columns: a single value ({@code 3}), a range ({@code 2-5}) or a
 * comma-separated list of both ({@code 1,3-4}). Ranges are kept as written, in order, and are only
 * expanded against the values they select from.
 */
public final class RangeSelection {

  private static final RangeSelection ALL = new RangeSelection(null);

  private final List<Span> spans;

  private RangeSelection(List<Span> spans) {
    this.spans = spans;
  }

  /** Parses a selection; null or blank selects everything. */
  public static RangeSelection parse(String spec, String nodePath) {
    if (spec == null || spec.isBlank()) {
      return ALL;
    }
    List<Span> spans = new ArrayList<>();
    for (String part : spec.split(",")) {
      String token = part.trim();
      int dash = token.indexOf('-');
      if (dash < 0) {
        int position = parsePosition(token, spec, nodePath);
        spans.add(new Span(position, position));
        continue;
      }
      int from = parsePosition(token.substring(0, dash).trim(), spec, nodePath);
      int to = parsePosition(token.substring(dash + 1).trim(), spec, nodePath);
      if (to < from) {
        throw new TabularImportException(
            "Descending range in selection \"" + spec + "\"", nodePath);
      }
      spans.add(new Span(from, to));
    }
    return new RangeSelection(Collections.unmodifiableList(spans));
  }

  public boolean selectsAll() {
    return spans == null;
  }

  /**
   * Selects from {@code values}; every selected position must exist.
   *
   * @throws TabularImportException naming the first position beyond the end
   */
  public <T> List<T> selectStrict(List<T> values, String nodePath) {
    if (selectsAll()) {
      return values;
    }
    List<T> selected = new ArrayList<>();
    for (Span span : spans) {
      if (span.to() > values.size()) {
        int position = Math.max(span.from(), values.size() + 1);
        throw new TabularImportException(
            "Selection refers to position " + position + " but only " + values.size() + " exist",
            nodePath);
      }
      selected.addAll(values.subList(span.from() - 1, span.to()));
    }
    return selected;
  }

  /**
   * Selects from {@code values} within the first {@code width} positions. Positions beyond {@code
   * width} are dropped; positions within it but past the end of {@code values} yield {@code
   * filler}.
   */
  public <T> List<T> selectWithin(List<T> values, int width, T filler) {
    if (selectsAll()) {
      return values;
    }
    List<T> selected = new ArrayList<>();
    for (Span span : spans) {
      int to = Math.min(span.to(), width);
      for (int position = span.from(); position <= to; position++) {
        selected.add(position <= values.size() ? values.get(position - 1) : filler);
      }
    }
    return selected;
  }

  private static int parsePosition(String token, String spec, String nodePath) {
    int position;
    try {
      position = Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new TabularImportException("Invalid selection \"" + spec + "\"", nodePath, e);
    }
    if (position < 1) {
      throw new TabularImportException("Selections are 1-based: \"" + spec + "\"", nodePath);
    }
    return position;
  }

  private record Span(int from, int to) {}
}
