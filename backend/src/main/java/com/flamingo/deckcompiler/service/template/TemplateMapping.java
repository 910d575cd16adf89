package com.flamingo.deckcompiler.service.template;

import com.flamingo.deckcompiler.exception.UnknownLayoutException;
import com.flamingo.deckcompiler.exception.UnknownPlaceholderException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name to index mapping for the layouts and placeholders of a template skeleton.
 *
 * <p>Immutable once loaded by {@link TemplateMappingParser}. Whether the indices exist in the
 * skeleton is checked by the format writer, not here.
 */
public final class TemplateMapping {

  private final Map<String, LayoutDef> layouts;

  public TemplateMapping(Map<String, LayoutDef> layouts) {
    this.layouts = Collections.unmodifiableMap(new LinkedHashMap<>(layouts));
  }

  public LayoutDef resolveLayout(String name) {
    return resolveLayout(name, null);
  }

  /**
   * Looks up a layout by name.
   *
   * @throws UnknownLayoutException if the mapping has no such layout
   */
  public LayoutDef resolveLayout(String name, String nodePath) {
    LayoutDef layout = layouts.get(name);
    if (layout == null) {
      throw new UnknownLayoutException(name, nodePath);
    }
    return layout;
  }

  public int resolvePlaceholder(LayoutDef layout, String name) {
    return resolvePlaceholder(layout, name, null);
  }

  /**
   * Looks up a placeholder index within a layout.
   *
   * @throws UnknownPlaceholderException if the layout has no such placeholder
   */
  public int resolvePlaceholder(LayoutDef layout, String name, String nodePath) {
    return layout
        .placeholderIndex(name)
        .orElseThrow(() -> new UnknownPlaceholderException(layout.name(), name, nodePath));
  }

  /** Layouts in the order the mapping document declares them. */
  public Collection<LayoutDef> layouts() {
    return layouts.values();
  }

  public int size() {
    return layouts.size();
  }
}
