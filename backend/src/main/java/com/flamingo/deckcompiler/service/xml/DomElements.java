package com.flamingo.deckcompiler.service.xml;

import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** Small DOM helpers shared by the mapping parser and the content tree builder. */
public final class DomElements {

  private DomElements() {}

  public static String nameOf(Element element) {
    return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
  }

  public static List<Element> childElements(Element parent) {
    List<Element> elements = new ArrayList<>();
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      if (children.item(i) instanceof Element child) {
        elements.add(child);
      }
    }
    return elements;
  }

  public static boolean isText(Node node) {
    return node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE;
  }

  public static boolean isBlankText(Node node) {
    return isText(node) && node.getNodeValue().isBlank();
  }

  /**
   * Returns the value of an attribute, or {@code null} when the element does not carry it.
   *
   * <p>{@link Element#getAttribute(String)} cannot tell an absent attribute from an empty one.
   */
  public static String attributeOrNull(Element element, String name) {
    return element.hasAttribute(name) ? element.getAttribute(name) : null;
  }

  /**
   * Path of an element from the document root, e.g. {@code /presentation/slide[2]/placeholder[1]}.
   *
   * <p>The ordinal counts preceding siblings with the same name and starts at 1. The root element
   * has no ordinal. Walks that visit every element use {@link NodePaths} instead.
   */
  public static String pathOf(Element element) {
    List<String> segments = new ArrayList<>();
    Node current = element;
    while (current instanceof Element el) {
      String name = nameOf(el);
      if (el.getParentNode() instanceof Element) {
        segments.add(0, name + "[" + ordinalOf(el, name) + "]");
      } else {
        segments.add(0, name);
      }
      current = el.getParentNode();
    }
    return "/" + String.join("/", segments);
  }

  private static int ordinalOf(Element element, String name) {
    int ordinal = 1;
    for (Node sibling = element.getPreviousSibling();
        sibling != null;
        sibling = sibling.getPreviousSibling()) {
      if (sibling instanceof Element other && nameOf(other).equals(name)) {
        ordinal++;
      }
    }
    return ordinal;
  }
}
