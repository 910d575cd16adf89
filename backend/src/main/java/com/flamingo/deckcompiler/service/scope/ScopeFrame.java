package com.flamingo.deckcompiler.service.scope;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Bindings introduced while one element is being visited. */
final class ScopeFrame {

  private final int id;
  private final String nodePath;
  private final Map<String, Binding> bindings = new HashMap<>();

  ScopeFrame(int id, String nodePath) {
    this.id = id;
    this.nodePath = nodePath;
  }

  int id() {
    return id;
  }

  String nodePath() {
    return nodePath;
  }

  boolean owns(String name) {
    return bindings.containsKey(name);
  }

  Optional<Binding> binding(String name) {
    return Optional.ofNullable(bindings.get(name));
  }

  void bind(String name, String value) {
    bindings.put(name, new Binding(id, value));
  }
}
