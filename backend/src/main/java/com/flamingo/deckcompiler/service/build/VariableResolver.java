package com.flamingo.deckcompiler.service.build;

import com.flamingo.deckcompiler.exception.AttributeException;
import com.flamingo.deckcompiler.exception.MalformedDocumentException;
import com.flamingo.deckcompiler.service.scope.ScopeEngine;
import com.flamingo.deckcompiler.service.xml.DomElements;
import com.flamingo.deckcompiler.service.xml.NodePaths;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Evaluates the variables of a presentation in one document-order walk, before the slide tree is
 * built.
 *
 * <p>Every element gets a scope frame while its children are walked. A {@code <set>} or {@code
 * <mod>} takes effect in the frame of its parent once its own content is evaluated, so it is seen
 * by every later sibling, including sub-element attributes such as {@code <layout>}. {@code
 * prepend} and {@code append} written as attributes are looked up on entry; written as child
 * elements they are looked up where they stand.
 *
 * <p>The walk records the value of every {@code <get>}, the affixes of every element and the child
 * elements it consumed ({@code var}, {@code prepend}, {@code append}). The builder reads those back
 * through {@link #valueOf}, {@link #affixesOf} and {@link #textOf}.
 */
@Slf4j
final class VariableResolver {

  static final String SET = "set";
  static final String MOD = "mod";
  static final String GET = "get";
  static final String VAR = "var";

  private static final String DATE = "date";
  private static final String LINK = "link";

  private final NodePaths paths;
  private final ScopeEngine scope = new ScopeEngine();
  private final Map<Element, String> values = new IdentityHashMap<>();
  private final Map<Element, Affixes> affixes = new IdentityHashMap<>();
  private final Set<Node> consumed = Collections.newSetFromMap(new IdentityHashMap<>());

  VariableResolver(NodePaths paths) {
    this.paths = paths;
  }

  /** Walks the subtree of {@code root}. */
  void resolve(Element root) {
    visit(root);
    log.debug(
        "Evaluated {} variable reads in {} scope frames", values.size(), scope.framesCreated());
  }

  /** Value of a {@code <get>}, with its own affixes applied. */
  String valueOf(Element get) {
    String value = values.get(get);
    if (value == null) {
      throw new IllegalStateException("No value recorded for " + paths.pathOf(get));
    }
    return value;
  }

  Affixes affixesOf(Element element) {
    return affixes.getOrDefault(element, Affixes.NONE);
  }

  /**
   * Plain text of {@code element} with recorded values substituted and its affixes applied.
   *
   * @throws MalformedDocumentException if the element contains a {@code <date/>} or {@code <link>}
   */
  String textOf(Element element) {
    TextRunBuilder run = new TextRunBuilder();
    appendContent(element, run);
    return affixesOf(element).apply(run.build().plainText());
  }

  private void visit(Element element) {
    scope.push(paths.pathOf(element));
    VariableTarget target;
    try {
      target = walk(element);
    } finally {
      scope.pop();
    }
    if (target == null) {
      return;
    }
    String value = textOf(element);
    if (SET.equals(target.kind())) {
      scope.set(target.name(), value);
    } else {
      scope.mod(target.name(), value);
    }
  }

  /** Walks the children of {@code element} in its open frame. */
  private VariableTarget walk(Element element) {
    String kind = DomElements.nameOf(element);
    boolean variable = SET.equals(kind) || MOD.equals(kind) || GET.equals(kind);

    String prependVar = DomElements.attributeOrNull(element, ContentTreeBuilder.PREPEND);
    String appendVar = DomElements.attributeOrNull(element, ContentTreeBuilder.APPEND);
    String prefix = prependVar == null ? null : scope.resolveAffix(prependVar, null, "");
    String suffix = appendVar == null ? null : scope.resolveAffix(null, appendVar, "");
    boolean prependOpen = prependVar == null;
    boolean appendOpen = appendVar == null;
    String name = variable ? DomElements.attributeOrNull(element, VAR) : null;
    boolean nameOpen = variable && name == null;

    for (Element child : DomElements.childElements(element)) {
      visit(child);
      String childName = DomElements.nameOf(child);
      if (prependOpen && ContentTreeBuilder.PREPEND.equals(childName)) {
        prefix = scope.get(textOf(child).trim());
        prependOpen = false;
        consumed.add(child);
      } else if (appendOpen && ContentTreeBuilder.APPEND.equals(childName)) {
        suffix = scope.get(textOf(child).trim());
        appendOpen = false;
        consumed.add(child);
      } else if (nameOpen && VAR.equals(childName)) {
        name = textOf(child);
        nameOpen = false;
        consumed.add(child);
      }
    }

    if (prefix != null || suffix != null) {
      affixes.put(
          element, new Affixes(prefix == null ? "" : prefix, suffix == null ? "" : suffix));
    }
    if (!variable) {
      return null;
    }
    if (name == null || name.isBlank()) {
      throw AttributeException.missing(kind, VAR, paths.pathOf(element));
    }
    if (GET.equals(kind)) {
      values.put(element, affixesOf(element).apply(scope.get(name.trim())));
      return null;
    }
    return new VariableTarget(kind, name.trim());
  }

  private void appendContent(Element element, TextRunBuilder run) {
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (DomElements.isText(child)) {
        run.text(child.getNodeValue());
      } else if (child instanceof Element nested && !consumed.contains(nested)) {
        appendElement(element, nested, run);
      }
    }
  }

  private void appendElement(Element parent, Element child, TextRunBuilder run) {
    switch (DomElements.nameOf(child)) {
      case SET, MOD -> {}
      case GET -> run.value(valueOf(child));
      case DATE, LINK -> throw new MalformedDocumentException(
          "<"
              + DomElements.nameOf(parent)
              + "> value must be plain text without <date/> or <link>",
          paths.pathOf(parent));
      default -> {
        Affixes group = affixesOf(child);
        run.value(group.prefix());
        appendContent(child, run);
        run.value(group.suffix());
      }
    }
  }

  private record VariableTarget(String kind, String name) {}
}
