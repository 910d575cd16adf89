package com.flamingo.deckcompiler.service.build;

import com.flamingo.deckcompiler.service.model.TextRun;

/**
 * Values of the {@code prepend} and {@code append} variables of an element, as recorded by {@link
 * VariableResolver}.
 */
record Affixes(String prefix, String suffix) {

  static final Affixes NONE = new Affixes("", "");

  boolean isEmpty() {
    return prefix.isEmpty() && suffix.isEmpty();
  }

  String apply(String raw) {
    return prefix + raw + suffix;
  }

  TextRun apply(TextRun run) {
    if (isEmpty()) {
      return run;
    }
    return new TextRunBuilder().value(prefix).run(run).value(suffix).buildVerbatim();
  }
}
