package com.flamingo.deckcompiler.service.table;

/**
 * A raw {@code weight} as written on a {@code <col>}, {@code <row>} setting or a content row.
 *
 * @param value the attribute value, null when the element carries no weight
 * @param nodePath path of the declaring element
 */
public record WeightDeclaration(String value, String nodePath) {

  public static final String MINIMUM = "min";

  public boolean isPresent() {
    return value != null && !value.isBlank();
  }

  public boolean isMinimum() {
    return isPresent() && MINIMUM.equals(value.trim());
  }
}
