package com.flamingo.deckcompiler.service.build;

import com.flamingo.deckcompiler.service.xml.DomElements;
import com.flamingo.deckcompiler.service.xml.NodePaths;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Resolves the recognized attributes of an element with a fixed precedence.
 *
 * <ol>
 *   <li>The attribute written on the element wins.
 *   <li>Otherwise the first direct child element with the same name supplies the value and is
 *       consumed. Its value comes from {@code childValue}.
 * </ol>
 *
 * <p>A child whose name is already covered by an attribute, or by an earlier child, stays in the
 * content of the element.
 */
public final class AttributeResolver {

  private final NodePaths paths;
  private final Function<Element, String> childValue;

  public AttributeResolver(NodePaths paths, Function<Element, String> childValue) {
    this.paths = paths;
    this.childValue = childValue;
  }

  public ResolvedAttributes resolve(Element element, Collection<String> names) {
    String path = paths.pathOf(element);
    Map<String, String> values = new HashMap<>();
    for (String name : names) {
      String attribute = DomElements.attributeOrNull(element, name);
      if (attribute != null) {
        values.put(name, attribute);
      }
    }

    Set<Node> consumed = new HashSet<>();
    for (Element child : DomElements.childElements(element)) {
      String name = DomElements.nameOf(child);
      if (names.contains(name) && !values.containsKey(name)) {
        values.put(name, childValue.apply(child));
        consumed.add(child);
      }
    }
    return new ResolvedAttributes(DomElements.nameOf(element), path, values, consumed);
  }
}
