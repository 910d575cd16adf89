package com.flamingo.deckcompiler.service.scope;

/**
 * A variable binding. The value changes only through {@code mod}; the owner never changes.
 *
 * <p>Package-private: callers only see values through {@link ScopeEngine}.
 */
final class Binding {

  private final int ownerFrameId;
  private String value;

  Binding(int ownerFrameId, String value) {
    this.ownerFrameId = ownerFrameId;
    this.value = value;
  }

  int ownerFrameId() {
    return ownerFrameId;
  }

  String value() {
    return value;
  }

  void overwrite(String newValue) {
    this.value = newValue;
  }
}
