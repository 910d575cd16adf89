package com.flamingo.deckcompiler.service.reference;

import com.flamingo.deckcompiler.exception.LabelException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Slide labels collected while the tree is built. Each label is written once, then only read.
 */
public final class LabelTable {

  private final Map<String, Integer> labels = new LinkedHashMap<>();

  /**
   * Records that {@code label} names the slide at {@code slideIndex}.
   *
   * @throws LabelException with {@code DUPLICATE_LABEL} if the label is already declared
   */
  public void declare(String label, int slideIndex, String nodePath) {
    if (labels.putIfAbsent(label, slideIndex) != null) {
      throw LabelException.duplicate(label, nodePath);
    }
  }

  public OptionalInt find(String label) {
    Integer index = labels.get(label);
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }

  public Map<String, Integer> asMap() {
    return Collections.unmodifiableMap(labels);
  }
}
