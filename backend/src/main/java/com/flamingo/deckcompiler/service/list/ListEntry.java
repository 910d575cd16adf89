package com.flamingo.deckcompiler.service.list;

import com.flamingo.deckcompiler.service.model.TextRun;

/**
 * A flattened list bullet.
 *
 * @param run bullet text
 * @param depth nesting level, 0 for top-level items
 */
public record ListEntry(TextRun run, int depth) {}
