package com.flamingo.deckcompiler.exception;

/** Exception thrown by the scope engine for invalid {@code set}, {@code mod} or {@code get}. */
public class VariableScopeException extends DeckCompilationException {

  private final String variable;

  private VariableScopeException(
      CompilationErrorCode errorCode, String variable, String message, String nodePath) {
    super(errorCode, message, nodePath);
    this.variable = variable;
  }

  public static VariableScopeException duplicateSet(String variable, String nodePath) {
    return new VariableScopeException(
        CompilationErrorCode.DUPLICATE_SET_IN_SCOPE,
        variable,
        "Variable \"" + variable + "\" is already set in this scope; use mod to change it",
        nodePath);
  }

  public static VariableScopeException undefined(String variable, String nodePath) {
    return new VariableScopeException(
        CompilationErrorCode.UNDEFINED_VARIABLE,
        variable,
        "Variable \"" + variable + "\" is not set in any enclosing scope",
        nodePath);
  }

  public String getVariable() {
    return variable;
  }
}
