package com.flamingo.deckcompiler.service.model;

/** One piece of a {@link TextRun}: literal text, a date to be stamped by the writer, or a link. */
public sealed interface TextSpan permits LiteralSpan, DateSpan, LinkSpan {}
