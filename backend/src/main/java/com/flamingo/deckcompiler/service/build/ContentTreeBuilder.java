package com.flamingo.deckcompiler.service.build;

import com.flamingo.deckcompiler.config.CompilerConfig;
import com.flamingo.deckcompiler.exception.AttributeException;
import com.flamingo.deckcompiler.exception.MalformedDocumentException;
import com.flamingo.deckcompiler.service.importer.ImportRequest;
import com.flamingo.deckcompiler.service.importer.TabularDataSource;
import com.flamingo.deckcompiler.service.list.ListItem;
import com.flamingo.deckcompiler.service.model.DateSpan;
import com.flamingo.deckcompiler.service.model.ImageContent;
import com.flamingo.deckcompiler.service.model.LinkSpan;
import com.flamingo.deckcompiler.service.model.ListContent;
import com.flamingo.deckcompiler.service.model.PlaceholderContent;
import com.flamingo.deckcompiler.service.model.PlaceholderKind;
import com.flamingo.deckcompiler.service.model.PlaceholderNode;
import com.flamingo.deckcompiler.service.model.Presentation;
import com.flamingo.deckcompiler.service.model.SlideNode;
import com.flamingo.deckcompiler.service.model.TableContent;
import com.flamingo.deckcompiler.service.model.TextContent;
import com.flamingo.deckcompiler.service.model.TextRun;
import com.flamingo.deckcompiler.service.reference.LabelTable;
import com.flamingo.deckcompiler.service.table.TableLayoutEngine;
import com.flamingo.deckcompiler.service.table.TableSpec;
import com.flamingo.deckcompiler.service.table.WeightDeclaration;
import com.flamingo.deckcompiler.service.template.LayoutDef;
import com.flamingo.deckcompiler.service.template.TemplateMapping;
import com.flamingo.deckcompiler.service.xml.DomElements;
import com.flamingo.deckcompiler.service.xml.NodePaths;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Walks a presentation document in document order and builds the unresolved slide tree.
 *
 * <p>Variables are evaluated first by a {@link VariableResolver} walk over the whole document, so
 * each {@code <get>}, {@code prepend} and {@code append} sees exactly the bindings made before it
 * in document order. The structural walk then reads those values back; {@code <set>} and {@code
 * <mod>} have no further effect in it. Attributes are resolved through {@link AttributeResolver}.
 * Slide labels are collected into a {@link LabelTable}; links stay symbolic until the {@link
 * com.flamingo.deckcompiler.service.reference.ForwardReferenceResolver} runs.
 *
 * <p>An instance serves a single {@link #build(Document)} call.
 */
@Slf4j
public class ContentTreeBuilder {

  static final String PREPEND = "prepend";
  static final String APPEND = "append";

  private static final String PRESENTATION = "presentation";
  private static final String SLIDE = "slide";
  private static final String PLACEHOLDER = "placeholder";
  private static final String SET = "set";
  private static final String MOD = "mod";
  private static final String GET = "get";
  private static final String DATE = "date";
  private static final String LINK = "link";
  private static final String SETTING = "setting";
  private static final String COL = "col";
  private static final String ROW = "row";
  private static final String CELL = "cell";
  private static final String IMPORT = "import";
  private static final String ITEM = "item";

  private static final List<String> AFFIXES = List.of(PREPEND, APPEND);
  private static final List<String> SLIDE_ATTRIBUTES = List.of("layout", "label", PREPEND, APPEND);
  private static final List<String> PLACEHOLDER_ATTRIBUTES =
      List.of("name", "type", PREPEND, APPEND);
  private static final List<String> VARIABLE_ATTRIBUTES = List.of("var", PREPEND, APPEND);
  private static final List<String> LINK_ATTRIBUTES = List.of("addr", "ref", PREPEND, APPEND);
  private static final List<String> DATE_ATTRIBUTES = List.of("format", PREPEND, APPEND);
  private static final List<String> WEIGHT_ATTRIBUTES = List.of("weight", PREPEND, APPEND);
  private static final List<String> IMPORT_ATTRIBUTES =
      List.of("sheet", "rows", "cols", PREPEND, APPEND);

  private final TemplateMapping mapping;
  private final TabularDataSource tabularDataSource;
  private final TableLayoutEngine tableLayoutEngine;
  private final CompilerConfig config;

  private final NodePaths paths = new NodePaths();
  private final VariableResolver variables = new VariableResolver(paths);
  private final AttributeResolver attributeResolver =
      new AttributeResolver(paths, variables::textOf);
  private final LabelTable labels = new LabelTable();
  private boolean used;

  public ContentTreeBuilder(
      TemplateMapping mapping,
      TabularDataSource tabularDataSource,
      TableLayoutEngine tableLayoutEngine,
      CompilerConfig config) {
    this.mapping = mapping;
    this.tabularDataSource = tabularDataSource;
    this.tableLayoutEngine = tableLayoutEngine;
    this.config = config;
  }

  /**
   * Builds the slide tree of {@code document}. Links to labels are left unresolved.
   *
   * @throws com.flamingo.deckcompiler.exception.DeckCompilationException on the first violation in
   *     document order
   * @throws IllegalStateException if this builder was already used
   */
  public Presentation build(Document document) {
    if (used) {
      throw new IllegalStateException("ContentTreeBuilder instances are single-use");
    }
    used = true;

    Element root = document.getDocumentElement();
    if (!PRESENTATION.equals(DomElements.nameOf(root))) {
      throw new MalformedDocumentException(
          "Root element must be <presentation>, found <" + DomElements.nameOf(root) + ">",
          paths.pathOf(root));
    }
    variables.resolve(root);

    List<SlideNode> slides = new ArrayList<>();
    ResolvedAttributes attributes = structural(root);
    for (Node child : structureOf(root, attributes)) {
      switch (elementName(child)) {
        case SLIDE -> slides.add(buildSlide((Element) child, slides.size()));
        case SET, MOD -> {}
        default -> throw unexpected(child, "<slide>, <set> or <mod>", attributes);
      }
    }
    if (slides.isEmpty()) {
      throw new MalformedDocumentException(
          "A presentation needs at least one <slide>", attributes.nodePath());
    }

    log.debug("Built {} slides with {} labels", slides.size(), labels.asMap().size());
    return new Presentation(slides, labels.asMap());
  }

  private SlideNode buildSlide(Element slide, int index) {
    ResolvedAttributes attributes = attributeResolver.resolve(slide, SLIDE_ATTRIBUTES);
    rejectAffixes(attributes);
    LayoutDef layout = mapping.resolveLayout(attributes.require("layout"), attributes.nodePath());
    String label = attributes.get("label");
    if (label != null && !label.isBlank()) {
      labels.declare(label, index, attributes.nodePath());
    } else {
      label = null;
    }

    List<PlaceholderNode> placeholders = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (Node child : structureOf(slide, attributes)) {
      switch (elementName(child)) {
        case PLACEHOLDER -> {
          PlaceholderNode placeholder = buildPlaceholder((Element) child, layout);
          if (!names.add(placeholder.name())) {
            throw new MalformedDocumentException(
                "Placeholder \"" + placeholder.name() + "\" is filled twice on this slide",
                placeholder.path());
          }
          placeholders.add(placeholder);
        }
        case SET, MOD -> {}
        default -> throw unexpected(child, "<placeholder>, <set> or <mod>", attributes);
      }
    }
    log.debug(
        "Slide {} uses layout {} with {} placeholders", index, layout.name(), placeholders.size());
    return new SlideNode(index, layout, label, placeholders, attributes.nodePath());
  }

  private PlaceholderNode buildPlaceholder(Element placeholder, LayoutDef layout) {
    ResolvedAttributes attributes = attributeResolver.resolve(placeholder, PLACEHOLDER_ATTRIBUTES);
    String path = attributes.nodePath();
    String name = attributes.require("name");
    int index = mapping.resolvePlaceholder(layout, name, path);

    Element wrapper = kindWrapper(placeholder, attributes);
    PlaceholderKind kind = placeholderKind(attributes, wrapper);
    if (wrapper == null) {
      return new PlaceholderNode(name, index, buildContent(kind, placeholder, attributes), path);
    }

    Affixes outer = contentAffixes(kind, placeholder, attributes);
    PlaceholderContent content = null;
    for (Node child : structureOf(placeholder, attributes)) {
      if (child == wrapper) {
        content = buildWrappedContent(kind, wrapper);
      } else if (!isVariable(child)) {
        throw unexpected(
            child, "only <set> or <mod> beside <" + kind.elementName() + ">", attributes);
      }
    }
    return new PlaceholderNode(name, index, decorate(content, outer), path);
  }

  private PlaceholderContent buildWrappedContent(PlaceholderKind kind, Element wrapper) {
    ResolvedAttributes attributes = attributeResolver.resolve(wrapper, AFFIXES);
    return buildContent(kind, wrapper, attributes);
  }

  /** Builds the payload from the content of {@code container}, applying its own affixes. */
  private PlaceholderContent buildContent(
      PlaceholderKind kind, Element container, ResolvedAttributes attributes) {
    Affixes affixes = contentAffixes(kind, container, attributes);
    return switch (kind) {
      case TEXT -> new TextContent(affixes.apply(textRun(container, attributes)));
      case IMAGE -> buildImage(container, attributes, affixes);
      case TABLE -> buildTable(container, attributes);
      case LIST -> buildList(container, attributes);
    };
  }

  private ImageContent buildImage(
      Element container, ResolvedAttributes attributes, Affixes affixes) {
    String imagePath = affixes.apply(plainText(container, attributes, "An image path"));
    if (imagePath.isEmpty()) {
      throw new MalformedDocumentException(
          "Image placeholder names no image file", attributes.nodePath());
    }
    return new ImageContent(imagePath);
  }

  private PlaceholderContent decorate(PlaceholderContent content, Affixes affixes) {
    if (affixes.isEmpty()) {
      return content;
    }
    return switch (content.kind()) {
      case TEXT -> new TextContent(affixes.apply(((TextContent) content).run()));
      case IMAGE -> new ImageContent(affixes.apply(((ImageContent) content).path()));
      case TABLE, LIST -> content;
    };
  }

  private Element kindWrapper(Element placeholder, ResolvedAttributes attributes) {
    Element wrapper = null;
    for (Node child : structureOf(placeholder, attributes)) {
      if (child instanceof Element element
          && PlaceholderKind.fromElementName(DomElements.nameOf(element)).isPresent()) {
        if (wrapper != null) {
          throw AttributeException.conflicting(
              "type",
              "Placeholder contains both <"
                  + DomElements.nameOf(wrapper)
                  + "> and <"
                  + DomElements.nameOf(element)
                  + ">",
              attributes.nodePath());
        }
        wrapper = element;
      }
    }
    return wrapper;
  }

  private PlaceholderKind placeholderKind(ResolvedAttributes attributes, Element wrapper) {
    Optional<PlaceholderKind> wrapped =
        Optional.ofNullable(wrapper)
            .flatMap(w -> PlaceholderKind.fromElementName(DomElements.nameOf(w)));
    String type = attributes.get("type");
    if (type == null) {
      return wrapped.orElse(PlaceholderKind.TEXT);
    }
    PlaceholderKind declared =
        PlaceholderKind.fromElementName(type)
            .orElseThrow(
                () ->
                    new MalformedDocumentException(
                        "Unknown placeholder type \"" + type + "\"", attributes.nodePath()));
    if (wrapped.isPresent() && wrapped.get() != declared) {
      throw AttributeException.conflicting(
          "type",
          "Placeholder type \""
              + declared.elementName()
              + "\" contradicts its <"
              + wrapped.get().elementName()
              + "> content",
          attributes.nodePath());
    }
    return declared;
  }

  /** Affixes decorate text and image payloads; tables and lists reject them. */
  private Affixes contentAffixes(
      PlaceholderKind kind, Element container, ResolvedAttributes attributes) {
    if (kind == PlaceholderKind.TABLE || kind == PlaceholderKind.LIST) {
      rejectAffixes(attributes);
      return Affixes.NONE;
    }
    return variables.affixesOf(container);
  }

  // Tables

  private TableContent buildTable(Element table, ResolvedAttributes attributes) {
    List<WeightDeclaration> columnSettings = new ArrayList<>();
    List<WeightDeclaration> rowSettings = new ArrayList<>();
    List<WeightDeclaration> rowOverrides = new ArrayList<>();
    List<List<TextRun>> rows = new ArrayList<>();

    for (Node child : structureOf(table, attributes)) {
      switch (elementName(child)) {
        case SETTING -> readSettings((Element) child, columnSettings, rowSettings);
        case ROW -> readRow((Element) child, rowOverrides, rows);
        case IMPORT -> readImport((Element) child, rowOverrides, rows);
        case SET, MOD -> {}
        default -> throw unexpected(
            child, "<setting>, <row>, <import>, <set> or <mod>", attributes);
      }
    }
    if (rows.isEmpty()) {
      throw new MalformedDocumentException("A table needs at least one row", attributes.nodePath());
    }

    TableSpec spec =
        tableLayoutEngine.buildSpec(
            columnSettings, rowSettings, rowOverrides, rows, attributes.nodePath());
    return new TableContent(spec, tableLayoutEngine.layout(spec));
  }

  private void readSettings(
      Element setting, List<WeightDeclaration> columns, List<WeightDeclaration> rows) {
    ResolvedAttributes attributes = structural(setting);
    for (Node child : structureOf(setting, attributes)) {
      switch (elementName(child)) {
        case COL -> columns.add(weightOf((Element) child));
        case ROW -> rows.add(weightOf((Element) child));
        case SET, MOD -> {}
        default -> throw unexpected(child, "<col>, <row>, <set> or <mod>", attributes);
      }
    }
  }

  private WeightDeclaration weightOf(Element element) {
    ResolvedAttributes attributes = attributeResolver.resolve(element, WEIGHT_ATTRIBUTES);
    rejectAffixes(attributes);
    requireEmpty(element, attributes);
    return new WeightDeclaration(attributes.get("weight"), attributes.nodePath());
  }

  private void readRow(Element row, List<WeightDeclaration> overrides, List<List<TextRun>> rows) {
    ResolvedAttributes attributes = attributeResolver.resolve(row, WEIGHT_ATTRIBUTES);
    rejectAffixes(attributes);
    List<TextRun> cells = new ArrayList<>();
    for (Node child : structureOf(row, attributes)) {
      switch (elementName(child)) {
        case CELL -> cells.add(cellRun((Element) child));
        case SET, MOD -> {}
        default -> throw unexpected(child, "<cell>, <set> or <mod>", attributes);
      }
    }
    overrides.add(new WeightDeclaration(attributes.get("weight"), attributes.nodePath()));
    rows.add(cells);
  }

  private TextRun cellRun(Element cell) {
    ResolvedAttributes attributes = attributeResolver.resolve(cell, AFFIXES);
    return variables.affixesOf(cell).apply(textRun(cell, attributes));
  }

  private void readImport(
      Element element, List<WeightDeclaration> overrides, List<List<TextRun>> rows) {
    ResolvedAttributes attributes = attributeResolver.resolve(element, IMPORT_ATTRIBUTES);
    rejectAffixes(attributes);
    ImportRequest request =
        new ImportRequest(
            plainText(element, attributes, "An import file name"),
            attributes.get("sheet"),
            attributes.get("rows"),
            attributes.get("cols"));
    for (List<String> cells : tabularDataSource.read(request, attributes.nodePath())) {
      rows.add(cells.stream().map(TextRun::of).toList());
      overrides.add(new WeightDeclaration(null, attributes.nodePath()));
    }
  }

  // Lists

  private ListContent buildList(Element list, ResolvedAttributes attributes) {
    List<ListItem> items = new ArrayList<>();
    for (Node child : structureOf(list, attributes)) {
      switch (elementName(child)) {
        case ITEM -> items.add(buildItem((Element) child));
        case SET, MOD -> {}
        default -> throw unexpected(child, "<item>, <set> or <mod>", attributes);
      }
    }
    return new ListContent(items);
  }

  private ListItem buildItem(Element item) {
    ResolvedAttributes attributes = attributeResolver.resolve(item, AFFIXES);
    TextRunBuilder run = new TextRunBuilder();
    List<ListItem> children = new ArrayList<>();
    for (Node child : contentOf(item, attributes)) {
      if (ITEM.equals(elementName(child))) {
        children.add(buildItem((Element) child));
      } else {
        appendInline(child, run);
      }
    }
    return new ListItem(variables.affixesOf(item).apply(run.build()), children);
  }

  // Inline text

  private TextRun textRun(Element container, ResolvedAttributes attributes) {
    TextRunBuilder run = new TextRunBuilder();
    for (Node child : contentOf(container, attributes)) {
      appendInline(child, run);
    }
    return run.build();
  }

  private String plainText(Element container, ResolvedAttributes attributes, String what) {
    TextRun run = textRun(container, attributes);
    if (!run.isPlain()) {
      throw new MalformedDocumentException(
          what + " must be plain text without <date/> or <link>", attributes.nodePath());
    }
    return run.plainText();
  }

  private void appendInline(Node node, TextRunBuilder run) {
    if (DomElements.isText(node)) {
      run.text(node.getNodeValue());
      return;
    }
    Element element = (Element) node;
    switch (elementName(element)) {
      case SET, MOD -> {}
      case GET -> run.value(evaluateGet(element));
      case DATE -> appendDate(element, run);
      case LINK -> run.span(buildLink(element));
      default -> appendGroup(element, run);
    }
  }

  /** Unknown inline elements are transparent: their content joins the surrounding run. */
  private void appendGroup(Element group, TextRunBuilder run) {
    ResolvedAttributes attributes = attributeResolver.resolve(group, AFFIXES);
    Affixes affixes = variables.affixesOf(group);
    run.value(affixes.prefix());
    for (Node child : contentOf(group, attributes)) {
      appendInline(child, run);
    }
    run.value(affixes.suffix());
  }

  private void appendDate(Element date, TextRunBuilder run) {
    ResolvedAttributes attributes = attributeResolver.resolve(date, DATE_ATTRIBUTES);
    Affixes affixes = variables.affixesOf(date);
    requireEmpty(date, attributes);
    String pattern = attributes.get("format");
    if (pattern == null) {
      pattern = config.getText().getDefaultDatePattern();
    }
    try {
      DateTimeFormatter.ofPattern(pattern);
    } catch (IllegalArgumentException e) {
      throw new MalformedDocumentException(
          "Invalid date format \"" + pattern + "\"", attributes.nodePath(), e);
    }
    run.value(affixes.prefix()).span(new DateSpan(pattern)).value(affixes.suffix());
  }

  private LinkSpan buildLink(Element link) {
    ResolvedAttributes attributes = attributeResolver.resolve(link, LINK_ATTRIBUTES);
    String path = attributes.nodePath();
    if (attributes.has("addr") && attributes.has("ref")) {
      throw AttributeException.conflicting(
          "ref", "<link> takes either addr or ref, not both", path);
    }
    if (!attributes.has("addr") && !attributes.has("ref")) {
      throw AttributeException.missing(LINK, "addr", path);
    }
    String text = variables.affixesOf(link).apply(plainText(link, attributes, "Link text"));
    if (attributes.has("addr")) {
      String address = attributes.get("addr");
      return LinkSpan.toAddress(text.isEmpty() ? address : text, address, path);
    }
    String label = attributes.require("ref");
    return LinkSpan.toLabel(text.isEmpty() ? label : text, label, path);
  }

  // Variables

  /** Value recorded for a {@code <get>}, which must not have content of its own. */
  private String evaluateGet(Element get) {
    ResolvedAttributes attributes = attributeResolver.resolve(get, VARIABLE_ATTRIBUTES);
    requireEmpty(get, attributes);
    return variables.valueOf(get);
  }

  // Helpers

  private ResolvedAttributes structural(Element element) {
    ResolvedAttributes attributes = attributeResolver.resolve(element, AFFIXES);
    rejectAffixes(attributes);
    return attributes;
  }

  private static void rejectAffixes(ResolvedAttributes attributes) {
    if (attributes.has(PREPEND) || attributes.has(APPEND)) {
      throw new MalformedDocumentException(
          "prepend and append are not allowed on <" + attributes.elementName() + ">",
          attributes.nodePath());
    }
  }

  /**
   * Content nodes of {@code element}: child elements and text, without comments, processing
   * instructions and children consumed as attribute values.
   */
  private static List<Node> contentOf(Element element, ResolvedAttributes attributes) {
    List<Node> nodes = new ArrayList<>();
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      boolean content = child instanceof Element || DomElements.isText(child);
      if (content && !attributes.isConsumed(child)) {
        nodes.add(child);
      }
    }
    return nodes;
  }

  /** Like {@link #contentOf} but without whitespace-only text, for elements that hold no text. */
  private static List<Node> structureOf(Element element, ResolvedAttributes attributes) {
    return contentOf(element, attributes).stream()
        .filter(node -> !DomElements.isBlankText(node))
        .toList();
  }

  private static void requireEmpty(Element element, ResolvedAttributes attributes) {
    List<Node> content = structureOf(element, attributes);
    if (!content.isEmpty()) {
      throw unexpected(content.get(0), "no content", attributes);
    }
  }

  private static boolean isVariable(Node node) {
    String name = elementName(node);
    return SET.equals(name) || MOD.equals(name);
  }

  /** Element name, or {@code "#text"} for text nodes. */
  private static String elementName(Node node) {
    return node instanceof Element element ? DomElements.nameOf(element) : "#text";
  }

  private static MalformedDocumentException unexpected(
      Node node, String expected, ResolvedAttributes parent) {
    if (node instanceof Element element) {
      return new MalformedDocumentException(
          "Unexpected <"
              + DomElements.nameOf(element)
              + "> in <"
              + parent.elementName()
              + ">; expected "
              + expected,
          DomElements.pathOf(element));
    }
    return new MalformedDocumentException(
        "Unexpected text \""
            + node.getNodeValue().strip()
            + "\" in <"
            + parent.elementName()
            + ">; expected "
            + expected,
        parent.nodePath());
  }
}
