package com.flamingo.deckcompiler.service.table;

import com.flamingo.deckcompiler.config.CompilerConfig;
import com.flamingo.deckcompiler.exception.MalformedDocumentException;
import com.flamingo.deckcompiler.exception.TableLayoutException;
import com.flamingo.deckcompiler.service.model.TextRun;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns weight declarations into a {@link TableSpec} and computes its {@link TableLayout}.
 *
 * <p>Column {@code i} receives {@code w_i / sum(w)} of the table width. The effective column
 * count is the larger of the number of {@code <col>} settings and the widest row; columns without
 * a setting use the configured default weight. Rows work the same way unless a single {@code <row
 * weight="min"/>} setting switches the whole table to {@link RowMode#MINIMUM}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TableLayoutEngine {

  private final CompilerConfig config;

  /**
   * Parses and validates the weight declarations of one table.
   *
   * @param columnSettings {@code <col>} settings in order
   * @param rowSettings {@code <row>} settings in order
   * @param rowOverrides weight declared on each content row, same size as {@code rows}
   * @param rows cell runs of every row, imported rows included
   * @param tablePath node path of the table, used when the table itself is at fault
   */
  public TableSpec buildSpec(
      List<WeightDeclaration> columnSettings,
      List<WeightDeclaration> rowSettings,
      List<WeightDeclaration> rowOverrides,
      List<List<TextRun>> rows,
      String tablePath) {
    if (rowOverrides.size() != rows.size()) {
      throw new IllegalArgumentException(
          "Expected one row override per row, got " + rowOverrides.size() + " for " + rows.size());
    }
    double defaultWeight = config.getTable().getDefaultWeight();

    int widestRow = rows.stream().mapToInt(List::size).max().orElse(0);
    int columnCount = Math.max(columnSettings.size(), widestRow);
    if (columnCount == 0) {
      throw new MalformedDocumentException("Table has no columns", tablePath);
    }
    List<Double> columnWeights = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      columnWeights.add(
          i < columnSettings.size()
              ? parseWeight(columnSettings.get(i), defaultWeight)
              : defaultWeight);
    }

    RowMode rowMode = detectRowMode(rowSettings, rowOverrides, tablePath);
    List<Double> rowWeights = new ArrayList<>();
    if (rowMode == RowMode.WEIGHTED) {
      for (int i = 0; i < rows.size(); i++) {
        WeightDeclaration override = rowOverrides.get(i);
        if (override.isPresent()) {
          rowWeights.add(parseWeight(override, defaultWeight));
        } else if (i < rowSettings.size()) {
          rowWeights.add(parseWeight(rowSettings.get(i), defaultWeight));
        } else {
          rowWeights.add(defaultWeight);
        }
      }
    }
    log.debug(
        "Table at {}: {} columns, {} rows, row mode {}",
        tablePath,
        columnCount,
        rows.size(),
        rowMode);
    return new TableSpec(columnWeights, rowMode, rowWeights, rows);
  }

  /** Normalizes the weights of a spec into fractions of the table extent. */
  public TableLayout layout(TableSpec spec) {
    List<Double> columns = normalize(spec.columnWeights());
    if (spec.rowMode() == RowMode.MINIMUM) {
      return new TableLayout(columns, List.of(), true);
    }
    return new TableLayout(columns, normalize(spec.rowWeights()), false);
  }

  private RowMode detectRowMode(
      List<WeightDeclaration> rowSettings, List<WeightDeclaration> rowOverrides, String tablePath) {
    for (WeightDeclaration override : rowOverrides) {
      if (override.isMinimum()) {
        throw new TableLayoutException(
            "weight=\"min\" must be declared once as a <row> setting for the whole table",
            override.nodePath());
      }
    }
    long minimumSettings = rowSettings.stream().filter(WeightDeclaration::isMinimum).count();
    if (minimumSettings == 0) {
      return RowMode.WEIGHTED;
    }
    if (minimumSettings > 1 || rowSettings.size() > 1) {
      throw new TableLayoutException(
          "weight=\"min\" applies to every row and cannot be combined with other row settings",
          tablePath);
    }
    for (WeightDeclaration override : rowOverrides) {
      if (override.isPresent()) {
        throw new TableLayoutException(
            "Row weight \"" + override.value() + "\" conflicts with weight=\"min\" for all rows",
            override.nodePath());
      }
    }
    return RowMode.MINIMUM;
  }

  private double parseWeight(WeightDeclaration declaration, double defaultWeight) {
    if (!declaration.isPresent()) {
      return defaultWeight;
    }
    if (declaration.isMinimum()) {
      throw new TableLayoutException(
          "weight=\"min\" is only supported as the single row setting", declaration.nodePath());
    }
    double weight;
    try {
      weight = Double.parseDouble(declaration.value().trim());
    } catch (NumberFormatException e) {
      throw new MalformedDocumentException(
          "Weight must be a number or \"min\": " + declaration.value(), declaration.nodePath());
    }
    if (!Double.isFinite(weight) || weight <= 0) {
      throw new MalformedDocumentException(
          "Weight must be a positive number: " + declaration.value(), declaration.nodePath());
    }
    return weight;
  }

  private static List<Double> normalize(List<Double> weights) {
    double sum = weights.stream().mapToDouble(Double::doubleValue).sum();
    return weights.stream().map(w -> w / sum).toList();
  }
}
