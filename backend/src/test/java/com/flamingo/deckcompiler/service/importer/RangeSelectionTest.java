package com.flamingo.deckcompiler.service.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.deckcompiler.exception.TabularImportException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RangeSelection")
class RangeSelectionTest {

  private static final List<String> VALUES = List.of("a", "b", "c", "d", "e");

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  "})
  void shouldSelectEverything_whenSelectionIsBlank(String spec) {
    RangeSelection selection = RangeSelection.parse(spec, "/p");

    assertThat(selection.selectsAll()).isTrue();
    assertThat(selection.selectStrict(VALUES, "/p")).isSameAs(VALUES);
    assertThat(selection.selectWithin(VALUES, 9, "")).isSameAs(VALUES);
  }

  @Test
  void shouldSelectRangesAndSingles_inWrittenOrder() {
    RangeSelection selection = RangeSelection.parse("4, 1-2 ,4", "/p");

    assertThat(selection.selectStrict(VALUES, "/p")).containsExactly("d", "a", "b", "d");
  }

  @Test
  void shouldFillMissingPositions_withinWidth() {
    RangeSelection selection = RangeSelection.parse("5-7", "/p");

    assertThat(selection.selectWithin(VALUES, 7, "")).containsExactly("e", "", "");
    assertThat(selection.selectWithin(VALUES, 6, "")).containsExactly("e", "");
  }

  @Test
  @DisplayName("an open-ended range is cut at the width without expanding it")
  void shouldClampRange_whenUpperBoundIsIntegerMax() {
    // Given
    RangeSelection selection = RangeSelection.parse("2-2147483647", "/p");

    // When
    List<String> selected = selection.selectWithin(VALUES, VALUES.size(), "");

    // Then
    assertThat(selected).containsExactly("b", "c", "d", "e");
  }

  @Test
  void shouldFailFast_whenStrictRangeEndsAtIntegerMax() {
    RangeSelection selection = RangeSelection.parse("1-2147483647", "/p");

    assertThatThrownBy(() -> selection.selectStrict(VALUES, "/p"))
        .isInstanceOf(TabularImportException.class)
        .hasMessageContaining("position 6");
  }

  @Test
  void shouldFailOnMissingPositions_whenStrict() {
    RangeSelection selection = RangeSelection.parse("6", "/p");

    assertThatThrownBy(() -> selection.selectStrict(VALUES, "/presentation/import[1]"))
        .isInstanceOf(TabularImportException.class)
        .hasFieldOrPropertyWithValue("nodePath", "/presentation/import[1]")
        .hasMessageContaining("position 6");
  }

  @ParameterizedTest
  @ValueSource(strings = {"3-1", "0", "x", "1,,2", "-2", "2-", "1-2147483648", "99999999999"})
  void shouldRejectInvalidSelections(String spec) {
    assertThatThrownBy(() -> RangeSelection.parse(spec, "/p"))
        .isInstanceOf(TabularImportException.class);
  }
}
