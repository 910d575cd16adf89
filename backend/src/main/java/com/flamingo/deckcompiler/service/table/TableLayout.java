package com.flamingo.deckcompiler.service.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Computed table geometry as fractions of the placeholder extent.
 *
 * @param columnFractions width share of each column, summing to 1
 * @param rowFractions height share of each row, summing to 1; empty when {@code minimumRowHeight}
 * @param minimumRowHeight {@code true} when the writer must size rows from their content
 */
public record TableLayout(
    List<Double> columnFractions, List<Double> rowFractions, boolean minimumRowHeight) {

  public TableLayout {
    columnFractions = List.copyOf(columnFractions);
    rowFractions = List.copyOf(rowFractions);
  }

  /** Splits {@code totalWidth} (e.g. EMU) into column widths that sum exactly to it. */
  public List<Long> columnWidths(long totalWidth) {
    return distribute(columnFractions, totalWidth);
  }

  /**
   * Splits {@code totalHeight} into row heights that sum exactly to it.
   *
   * @throws IllegalStateException in minimum row mode, where heights come from content
   */
  public List<Long> rowHeights(long totalHeight) {
    if (minimumRowHeight) {
      throw new IllegalStateException("Row heights are content-driven in minimum row mode");
    }
    return distribute(rowFractions, totalHeight);
  }

  private static List<Long> distribute(List<Double> fractions, long total) {
    List<Long> parts = new ArrayList<>(fractions.size());
    long assigned = 0;
    for (int i = 0; i < fractions.size(); i++) {
      long part =
          i == fractions.size() - 1 ? total - assigned : Math.round(total * fractions.get(i));
      parts.add(part);
      assigned += part;
    }
    return parts;
  }
}
