package com.flamingo.deckcompiler.service.model;

/**
 * Literal text.
 *
 * @param text the text, never null
 */
public record LiteralSpan(String text) implements TextSpan {}
