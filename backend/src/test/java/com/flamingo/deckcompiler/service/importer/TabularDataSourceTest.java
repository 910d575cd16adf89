package com.flamingo.deckcompiler.service.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.deckcompiler.config.CompilerConfig;
import com.flamingo.deckcompiler.exception.CompilationErrorCode;
import com.flamingo.deckcompiler.exception.TabularImportException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TabularDataSource")
class TabularDataSourceTest {

  private static final String PATH = "/presentation/slide[1]/placeholder[1]/table[1]/import[1]";

  @Mock private TabularDataReader xlsxReader;
  @Mock private TabularDataReader csvReader;

  @TempDir Path baseDirectory;

  private CompilerConfig config;
  private TabularDataSource source;

  @BeforeEach
  void setUp() {
    config = new CompilerConfig();
    config.getImporting().setBaseDirectory(baseDirectory.toString());
    lenient()
        .when(xlsxReader.supports(anyString()))
        .thenAnswer(i -> i.<String>getArgument(0).endsWith(".xlsx"));
    lenient()
        .when(csvReader.supports(anyString()))
        .thenAnswer(i -> i.<String>getArgument(0).endsWith(".csv"));
    source = new TabularDataSource(List.of(xlsxReader, csvReader), config);
  }

  @Test
  void shouldRouteToSupportingReader_andApplySelections() throws Exception {
    // Given
    Path file = Files.writeString(baseDirectory.resolve("data.csv"), "ignored");
    when(csvReader.read(file, "Q1", PATH))
        .thenReturn(
            List.of(
                List.of("h1", "h2", "h3"),
                List.of("a", "b", "c"),
                List.of("d", "e"),
                List.of("f", "g", "h")));

    // When
    List<List<String>> rows =
        source.read(new ImportRequest("data.csv", "Q1", "2-3", "3,1"), PATH);

    // Then
    assertThat(rows).containsExactly(List.of("c", "a"), List.of("", "d"));
    verify(xlsxReader, never()).read(any(), any(), any());
  }

  @Test
  void shouldReturnAllRows_whenNoSelectionIsGiven() throws Exception {
    Path file = Files.writeString(baseDirectory.resolve("sheet.xlsx"), "ignored");
    List<List<String>> all = List.of(List.of("x"), List.of("y"));
    when(xlsxReader.read(file, null, PATH)).thenReturn(all);

    assertThat(source.read(new ImportRequest("sheet.xlsx", null, null, null), PATH))
        .isEqualTo(all);
  }

  @Test
  void shouldFail_whenImportsAreDisabled() {
    config.getImporting().setEnabled(false);

    assertThatThrownBy(() -> source.read(new ImportRequest("data.csv", null, null, null), PATH))
        .isInstanceOf(TabularImportException.class)
        .hasFieldOrPropertyWithValue("errorCode", CompilationErrorCode.TABULAR_IMPORT_FAILED)
        .hasMessageContaining("disabled");
  }

  @Test
  void shouldFail_whenFormatIsUnsupported() throws Exception {
    Files.writeString(baseDirectory.resolve("notes.txt"), "ignored");

    assertThatThrownBy(() -> source.read(new ImportRequest("notes.txt", null, null, null), PATH))
        .isInstanceOf(TabularImportException.class)
        .hasMessageContaining("Unsupported");
  }

  @Test
  void shouldFail_whenFileIsMissing() {
    assertThatThrownBy(() -> source.read(new ImportRequest("absent.csv", null, null, null), PATH))
        .isInstanceOf(TabularImportException.class)
        .hasFieldOrPropertyWithValue("nodePath", PATH)
        .hasMessageContaining("not found");
  }

  @Test
  void shouldFail_whenFileNameIsBlank() {
    assertThatThrownBy(() -> source.read(new ImportRequest(" ", null, null, null), PATH))
        .isInstanceOf(TabularImportException.class);
  }

  @Test
  void shouldWrapReaderFailures() throws Exception {
    Path file = Files.writeString(baseDirectory.resolve("broken.csv"), "ignored");
    when(csvReader.read(eq(file), any(), eq(PATH))).thenThrow(new IOException("truncated"));

    assertThatThrownBy(() -> source.read(new ImportRequest("broken.csv", null, null, null), PATH))
        .isInstanceOf(TabularImportException.class)
        .hasMessageContaining("truncated")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void shouldFail_whenFileNameEscapesImportDirectory() throws Exception {
    // Given
    Path outside = Files.createTempFile("secret", ".csv");

    // When / Then
    for (String name : List.of("../secret.csv", "nested/../../secret.csv", outside.toString())) {
      assertThatThrownBy(() -> source.read(new ImportRequest(name, null, null, null), PATH))
          .isInstanceOf(TabularImportException.class)
          .hasFieldOrPropertyWithValue("nodePath", PATH)
          .hasMessageContaining("outside the import directory");
    }
    verify(csvReader, never()).read(any(), any(), any());
    Files.deleteIfExists(outside);
  }

  @Test
  void shouldReadFile_inSubdirectoryOfImportDirectory() throws Exception {
    Files.createDirectories(baseDirectory.resolve("q1"));
    Path file = Files.writeString(baseDirectory.resolve("q1/data.csv"), "ignored");
    when(csvReader.read(file, null, PATH)).thenReturn(List.of(List.of("x")));

    assertThat(source.read(new ImportRequest("q1/./data.csv", null, null, null), PATH))
        .containsExactly(List.of("x"));
  }

  @Test
  void shouldPadColumns_onlyUpToWidestRow_whenRangeIsOpenEnded() throws Exception {
    Path file = Files.writeString(baseDirectory.resolve("wide.csv"), "ignored");
    when(csvReader.read(file, null, PATH))
        .thenReturn(List.of(List.of("a", "b", "c"), List.of("d")));

    assertThat(source.read(new ImportRequest("wide.csv", null, null, "2-2147483647"), PATH))
        .containsExactly(List.of("b", "c"), List.of("", ""));
  }

  @Test
  void shouldFail_whenRowSelectionExceedsFile() throws Exception {
    Path file = Files.writeString(baseDirectory.resolve("short.csv"), "ignored");
    when(csvReader.read(file, null, PATH)).thenReturn(List.of(List.of("only")));

    assertThatThrownBy(() -> source.read(new ImportRequest("short.csv", null, "1-2", null), PATH))
        .isInstanceOf(TabularImportException.class)
        .hasMessageContaining("position 2");
  }
}
