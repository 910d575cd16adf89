package com.flamingo.deckcompiler.service.table;

/** How row heights of a table are determined. */
public enum RowMode {
  /** Heights are shares of the table height, proportional to row weights. */
  WEIGHTED,

  /** Every row takes the minimum height its content needs; the writer measures it. */
  MINIMUM
}
