package com.flamingo.deckcompiler.service.table;

import com.flamingo.deckcompiler.service.model.TextRun;
import java.util.List;

/**
 * A table as declared by the document, with weights already parsed and defaulted.
 *
 * @param columnWeights one weight per effective column
 * @param rowMode how row heights are determined
 * @param rowWeights one weight per row in {@link RowMode#WEIGHTED} mode, empty in {@link
 *     RowMode#MINIMUM} mode
 * @param rows cell runs, row by row; rows may be shorter than the column count
 */
public record TableSpec(
    List<Double> columnWeights,
    RowMode rowMode,
    List<Double> rowWeights,
    List<List<TextRun>> rows) {

  public TableSpec {
    columnWeights = List.copyOf(columnWeights);
    rowWeights = List.copyOf(rowWeights);
    rows = rows.stream().map(List::copyOf).toList();
  }

  public int columnCount() {
    return columnWeights.size();
  }

  public int rowCount() {
    return rows.size();
  }

  /** Cell run at the given position, {@link TextRun#EMPTY} where a short row has no cell. */
  public TextRun cell(int row, int column) {
    List<TextRun> cells = rows.get(row);
    return column < cells.size() ? cells.get(column) : TextRun.EMPTY;
  }
}
