package com.flamingo.deckcompiler.service.build;

import com.flamingo.deckcompiler.exception.AttributeException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.w3c.dom.Node;

/**
 * Effective attribute values of one element, after merging the attribute and sub-element forms.
 *
 * <p>Child elements consumed as attribute values are remembered so that content walks skip them.
 */
public final class ResolvedAttributes {

  private final String elementName;
  private final String nodePath;
  private final Map<String, String> values;
  private final Set<Node> consumed;

  ResolvedAttributes(
      String elementName, String nodePath, Map<String, String> values, Set<Node> consumed) {
    this.elementName = elementName;
    this.nodePath = nodePath;
    this.values = Collections.unmodifiableMap(values);
    this.consumed = Collections.unmodifiableSet(consumed);
  }

  /** Value of {@code name}, or {@code null} when neither form is present. */
  public String get(String name) {
    return values.get(name);
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  /**
   * Value of a required attribute.
   *
   * @throws AttributeException with {@code MISSING_REQUIRED_ATTRIBUTE} if absent or blank
   */
  public String require(String name) {
    String value = values.get(name);
    if (value == null || value.isBlank()) {
      throw AttributeException.missing(elementName, name, nodePath);
    }
    return value;
  }

  /** {@code true} if {@code node} was consumed as an attribute value and is not content. */
  public boolean isConsumed(Node node) {
    return consumed.contains(node);
  }

  public String elementName() {
    return elementName;
  }

  public String nodePath() {
    return nodePath;
  }
}
