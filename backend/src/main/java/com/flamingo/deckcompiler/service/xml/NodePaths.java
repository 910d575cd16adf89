package com.flamingo.deckcompiler.service.xml;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import org.w3c.dom.Element;

/**
 * Memoized {@link DomElements#pathOf(Element)} for walks that visit every element of a document.
 *
 * <p>The first lookup below a parent numbers all of its child elements in one pass, so a full walk
 * costs time linear in the size of the document. Instances are not thread-safe.
 */
public final class NodePaths {

  private final Map<Element, String> paths = new IdentityHashMap<>();

  public String pathOf(Element element) {
    String path = paths.get(element);
    if (path != null) {
      return path;
    }
    if (!(element.getParentNode() instanceof Element parent)) {
      path = "/" + DomElements.nameOf(element);
      paths.put(element, path);
      return path;
    }
    numberChildren(parent);
    return paths.get(element);
  }

  private void numberChildren(Element parent) {
    String parentPath = pathOf(parent);
    Map<String, Integer> ordinals = new HashMap<>();
    for (Element child : DomElements.childElements(parent)) {
      String name = DomElements.nameOf(child);
      int ordinal = ordinals.merge(name, 1, Integer::sum);
      paths.put(child, parentPath + "/" + name + "[" + ordinal + "]");
    }
  }
}
