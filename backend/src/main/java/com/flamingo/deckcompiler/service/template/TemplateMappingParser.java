package com.flamingo.deckcompiler.service.template;

import static com.flamingo.deckcompiler.service.xml.DomElements.attributeOrNull;
import static com.flamingo.deckcompiler.service.xml.DomElements.childElements;
import static com.flamingo.deckcompiler.service.xml.DomElements.nameOf;
import static com.flamingo.deckcompiler.service.xml.DomElements.pathOf;

import com.flamingo.deckcompiler.exception.CompilationErrorCode;
import com.flamingo.deckcompiler.exception.TemplateMappingException;
import com.flamingo.deckcompiler.service.xml.XmlDocumentLoader;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * Loads a template mapping document.
 *
 * <pre>{@code
 * <template>
 *   <layout name="title" index="0">
 *     <placeholder name="title" index="0"/>
 *     <placeholder name="subtitle" index="1"/>
 *   </layout>
 * </template>
 * }</pre>
 *
 * <p>The whole document is validated before a {@link TemplateMapping} is returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateMappingParser {

  static final String TEMPLATE = "template";
  static final String LAYOUT = "layout";
  static final String PLACEHOLDER = "placeholder";

  private final XmlDocumentLoader documentLoader;

  public TemplateMapping parse(InputStream inputStream) {
    Element root;
    try {
      root = documentLoader.load(inputStream).getDocumentElement();
    } catch (SAXException | IOException e) {
      throw new TemplateMappingException(
          "Template mapping is not well-formed XML: " + e.getMessage(), e);
    }

    if (!TEMPLATE.equals(nameOf(root))) {
      throw TemplateMappingException.malformed(
          "Root element must be <template>, found <" + nameOf(root) + ">", pathOf(root));
    }

    Map<String, LayoutDef> layouts = new LinkedHashMap<>();
    for (Element child : childElements(root)) {
      String name = nameOf(child);
      if (LAYOUT.equals(name)) {
        LayoutDef layout = parseLayout(child);
        if (layouts.putIfAbsent(layout.name(), layout) != null) {
          throw new TemplateMappingException(
              CompilationErrorCode.DUPLICATE_LAYOUT_NAME,
              "Layout name declared twice: " + layout.name(),
              pathOf(child));
        }
      } else {
        throw misplaced(child, TEMPLATE);
      }
    }

    if (layouts.isEmpty()) {
      throw TemplateMappingException.malformed("Template declares no layouts", pathOf(root));
    }
    log.debug("Loaded template mapping with {} layouts", layouts.size());
    return new TemplateMapping(layouts);
  }

  private LayoutDef parseLayout(Element layout) {
    String name = requireName(layout);
    int index = requireIndex(layout);

    Map<String, Integer> placeholders = new LinkedHashMap<>();
    for (Element child : childElements(layout)) {
      if (!PLACEHOLDER.equals(nameOf(child))) {
        throw misplaced(child, LAYOUT);
      }
      String placeholderName = requireName(child);
      int placeholderIndex = requireIndex(child);
      List<Element> nested = childElements(child);
      if (!nested.isEmpty()) {
        throw misplaced(nested.get(0), PLACEHOLDER);
      }
      if (placeholders.putIfAbsent(placeholderName, placeholderIndex) != null) {
        throw new TemplateMappingException(
            CompilationErrorCode.DUPLICATE_PLACEHOLDER_NAME,
            String.format(
                "Placeholder name \"%s\" declared twice in layout \"%s\"", placeholderName, name),
            pathOf(child));
      }
    }
    return new LayoutDef(name, index, placeholders);
  }

  private TemplateMappingException misplaced(Element element, String parentName) {
    String name = nameOf(element);
    String message =
        switch (name) {
          case TEMPLATE -> "Only one <template> element is allowed, as the root";
          case LAYOUT -> "<layout> must be a direct child of <template>";
          case PLACEHOLDER -> "<placeholder> must be a direct child of a <layout>";
          default -> "Invalid element <" + name + "> inside <" + parentName + ">";
        };
    return TemplateMappingException.malformed(message, pathOf(element));
  }

  private String requireName(Element element) {
    String name = attributeOrNull(element, "name");
    if (name == null || name.isBlank()) {
      throw TemplateMappingException.malformed(
          "<" + nameOf(element) + "> is missing its name attribute", pathOf(element));
    }
    return name.trim();
  }

  private int requireIndex(Element element) {
    String raw = attributeOrNull(element, "index");
    if (raw == null || raw.isBlank()) {
      throw TemplateMappingException.malformed(
          "<" + nameOf(element) + "> is missing its index attribute", pathOf(element));
    }
    int index;
    try {
      index = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw TemplateMappingException.malformed(
          "Index must be an integer, found \"" + raw + "\"", pathOf(element));
    }
    if (index < 0) {
      throw TemplateMappingException.malformed(
          "Index must not be negative, found " + index, pathOf(element));
    }
    return index;
  }
}
