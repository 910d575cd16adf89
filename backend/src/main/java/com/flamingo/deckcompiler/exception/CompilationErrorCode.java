package com.flamingo.deckcompiler.exception;

/** Machine-readable codes for every way a deck can fail to compile. */
public enum CompilationErrorCode {
  /** The template mapping document violates its structure rules. */
  MALFORMED_MAPPING,

  /** Two layouts in one mapping share a name. */
  DUPLICATE_LAYOUT_NAME,

  /** Two placeholders in one layout share a name. */
  DUPLICATE_PLACEHOLDER_NAME,

  /** A slide names a layout the mapping does not define. */
  UNKNOWN_LAYOUT,

  /** A placeholder name is not defined by the slide's layout. */
  UNKNOWN_PLACEHOLDER,

  /** A required attribute is absent in both attribute and sub-element form. */
  MISSING_REQUIRED_ATTRIBUTE,

  /** Two declarations of the same attribute disagree. */
  CONFLICTING_ATTRIBUTE,

  /** Two slides declare the same label. */
  DUPLICATE_LABEL,

  /** A link references a label no slide declares. */
  UNRESOLVED_LABEL,

  /** A variable is set twice in the same scope. */
  DUPLICATE_SET_IN_SCOPE,

  /** A variable is read or modified before any enclosing scope sets it. */
  UNDEFINED_VARIABLE,

  /** Minimum row mode combined with explicit per-row weights. */
  UNSUPPORTED_MIXED_ROW_MODE,

  /** The presentation document violates its structure rules. */
  MALFORMED_DOCUMENT,

  /** Tabular data could not be imported. */
  TABULAR_IMPORT_FAILED
}
