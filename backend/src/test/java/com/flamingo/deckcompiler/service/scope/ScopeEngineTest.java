package com.flamingo.deckcompiler.service.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.deckcompiler.exception.CompilationErrorCode;
import com.flamingo.deckcompiler.exception.VariableScopeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScopeEngine")
class ScopeEngineTest {

  private ScopeEngine scope;

  @BeforeEach
  void setUp() {
    scope = new ScopeEngine();
    scope.push("/presentation");
  }

  @Test
  void shouldFailGet_whenVariableWasNeverSet() {
    assertThatThrownBy(() -> scope.get("v"))
        .isInstanceOf(VariableScopeException.class)
        .extracting(e -> ((VariableScopeException) e).getErrorCode())
        .isEqualTo(CompilationErrorCode.UNDEFINED_VARIABLE);
  }

  @Test
  void shouldFailMod_whenVariableWasNeverSet() {
    assertThatThrownBy(() -> scope.mod("v", "x"))
        .isInstanceOf(VariableScopeException.class)
        .hasMessageContaining("\"v\"");
  }

  @Test
  @DisplayName("inner set shadows until its frame is popped")
  void shouldShadowOuterBinding_whenInnerFrameSetsSameName() {
    // Given
    scope.push("/presentation/slide[1]");
    scope.set("b", "b1");

    // When
    scope.push("/presentation/slide[1]/placeholder[1]");
    scope.set("b", "b2");
    String inner = scope.get("b");
    scope.pop();
    scope.push("/presentation/slide[1]/placeholder[2]");
    String sibling = scope.get("b");

    // Then
    assertThat(inner).isEqualTo("b2");
    assertThat(sibling).isEqualTo("b1");
  }

  @Test
  void shouldModifyInnerBinding_whenModFollowsInnerSet() {
    scope.push("/presentation/slide[1]");
    scope.set("b", "b1");

    scope.push("/presentation/slide[1]/placeholder[1]");
    scope.set("b", "b2");
    scope.mod("b", "b3");
    assertThat(scope.get("b")).isEqualTo("b3");
    scope.pop();

    scope.push("/presentation/slide[1]/placeholder[2]");
    assertThat(scope.get("b")).isEqualTo("b1");
  }

  @Test
  @DisplayName("slide bindings do not leak to the presentation root")
  void shouldForgetSlideBindings_whenSlideFrameIsPopped() {
    scope.push("/presentation/slide[1]");
    scope.set("a", "a1");
    scope.mod("a", "a2");
    assertThat(scope.get("a")).isEqualTo("a2");
    scope.pop();

    assertThatThrownBy(() -> scope.get("a"))
        .isInstanceOf(VariableScopeException.class)
        .hasFieldOrPropertyWithValue("nodePath", "/presentation");
  }

  @Test
  void shouldWriteThroughToOwningFrame_whenModIsCalledFromNestedFrame() {
    // Given
    scope.set("c", "x");

    // When
    scope.push("/presentation/slide[1]");
    scope.mod("c", "y");
    scope.pop();
    scope.push("/presentation/slide[2]");

    // Then
    assertThat(scope.get("c")).isEqualTo("y");
    assertThat(scope.ownerOf("c")).isZero();
  }

  @Test
  void shouldRejectSecondSet_whenSameFrameAlreadyOwnsName() {
    scope.push("/presentation/slide[1]");
    scope.set("x", "1");

    assertThatThrownBy(() -> scope.set("x", "2"))
        .isInstanceOf(VariableScopeException.class)
        .extracting(e -> ((VariableScopeException) e).getErrorCode())
        .isEqualTo(CompilationErrorCode.DUPLICATE_SET_IN_SCOPE);
  }

  @Test
  @DisplayName("set in a nested frame shadows even after an ancestor binding was modified")
  void shouldShadow_whenSetFollowsModOfAncestorBinding() {
    scope.set("v", "outer");
    scope.push("/presentation/slide[1]");
    scope.mod("v", "modified");

    scope.set("v", "inner");

    assertThat(scope.get("v")).isEqualTo("inner");
    scope.pop();
    assertThat(scope.get("v")).isEqualTo("modified");
  }

  @Test
  void shouldDecorateRawValue_whenAffixVariablesAreGiven() {
    scope.set("pre", "[");
    scope.set("post", "]");

    assertThat(scope.resolveAffix("pre", "post", "x")).isEqualTo("[x]");
    assertThat(scope.resolveAffix(null, "post", "x")).isEqualTo("x]");
    assertThat(scope.resolveAffix(null, null, "x")).isEqualTo("x");
    assertThatThrownBy(() -> scope.resolveAffix("missing", null, "x"))
        .isInstanceOf(VariableScopeException.class);
  }

  @Test
  void shouldTrackDepthAndFrames() {
    scope.push();
    scope.push();
    assertThat(scope.depth()).isEqualTo(3);
    scope.pop();
    scope.pop();
    scope.push();

    assertThat(scope.depth()).isEqualTo(2);
    assertThat(scope.framesCreated()).isEqualTo(4);
  }

  @Test
  void shouldAssignFreshIds_whenFramesArePoppedAndPushedAgain() {
    int first = scope.push("/presentation/slide[1]");
    scope.set("a", "1");
    scope.pop();

    int second = scope.push("/presentation/slide[2]");
    scope.set("a", "2");

    assertThat(second).isGreaterThan(first);
    assertThat(scope.ownerOf("a")).isEqualTo(second);
    assertThat(scope.depth()).isEqualTo(2);
  }

  @Test
  void shouldRejectPop_whenNoFrameIsOpen() {
    scope.pop();

    assertThatThrownBy(() -> scope.pop()).isInstanceOf(IllegalStateException.class);
  }
}
