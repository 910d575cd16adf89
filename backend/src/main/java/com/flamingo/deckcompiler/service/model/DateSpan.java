package com.flamingo.deckcompiler.service.model;

/**
 * Marks the position where the writer inserts the compilation date.
 *
 * @param pattern {@link java.time.format.DateTimeFormatter} pattern the writer formats with
 */
public record DateSpan(String pattern) implements TextSpan {}
