package com.flamingo.deckcompiler.service.build;

import com.flamingo.deckcompiler.service.model.LiteralSpan;
import com.flamingo.deckcompiler.service.model.TextRun;
import com.flamingo.deckcompiler.service.model.TextSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Accumulates spans for a {@link TextRun}.
 *
 * <p>Document text passed to {@link #text(String)} has whitespace runs collapsed to one space,
 * also across node boundaries. Values passed to {@link #value(String)} are kept verbatim. Adjacent
 * literals are merged.
 */
final class TextRunBuilder {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final List<TextSpan> spans = new ArrayList<>();
  private final StringBuilder pending = new StringBuilder();

  TextRunBuilder text(String raw) {
    String collapsed = WHITESPACE.matcher(raw).replaceAll(" ");
    if (collapsed.startsWith(" ") && endsWithSpace()) {
      collapsed = collapsed.substring(1);
    }
    pending.append(collapsed);
    return this;
  }

  TextRunBuilder value(String value) {
    pending.append(value);
    return this;
  }

  TextRunBuilder span(TextSpan span) {
    if (span instanceof LiteralSpan literal) {
      return value(literal.text());
    }
    flush();
    spans.add(span);
    return this;
  }

  TextRunBuilder run(TextRun run) {
    run.spans().forEach(this::span);
    return this;
  }

  /** Builds the run with leading and trailing whitespace of the outer literals removed. */
  TextRun build() {
    flush();
    List<TextSpan> result = new ArrayList<>(spans);
    if (!result.isEmpty() && result.get(0) instanceof LiteralSpan first) {
      replaceOrDrop(result, 0, first.text().stripLeading());
    }
    int last = result.size() - 1;
    if (last >= 0 && result.get(last) instanceof LiteralSpan literal) {
      replaceOrDrop(result, last, literal.text().stripTrailing());
    }
    return new TextRun(result);
  }

  /** Builds the run as accumulated. */
  TextRun buildVerbatim() {
    flush();
    return new TextRun(spans);
  }

  private boolean endsWithSpace() {
    if (pending.length() > 0) {
      return Character.isWhitespace(pending.charAt(pending.length() - 1));
    }
    if (!spans.isEmpty() && spans.get(spans.size() - 1) instanceof LiteralSpan literal) {
      return literal.text().endsWith(" ");
    }
    return false;
  }

  private void flush() {
    if (pending.length() > 0) {
      spans.add(new LiteralSpan(pending.toString()));
      pending.setLength(0);
    }
  }

  private static void replaceOrDrop(List<TextSpan> spans, int index, String text) {
    if (text.isEmpty()) {
      spans.remove(index);
    } else {
      spans.set(index, new LiteralSpan(text));
    }
  }
}
