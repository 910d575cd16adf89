package com.flamingo.deckcompiler.service.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.flamingo.deckcompiler.service.xml.XmlDocumentLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CsvTabularDataReader")
class CsvTabularDataReaderTest {

  private final CsvTabularDataReader reader = new CsvTabularDataReader(new XmlDocumentLoader());

  @TempDir Path tempDir;

  @Test
  void shouldSupportCsvExtension_only() {
    assertThat(reader.supports("data.csv")).isTrue();
    assertThat(reader.supports("DATA.CSV")).isTrue();
    assertThat(reader.supports("data.xlsx")).isFalse();
    assertThat(reader.supports(null)).isFalse();
  }

  @Test
  void shouldReadRowsAndCells_includingQuotedCommas() throws Exception {
    // Given
    Path file =
        Files.writeString(
            tempDir.resolve("growth.csv"), "Quarter,Growth\nQ1,12\n\"Q2, late\",9\n");

    // When
    List<List<String>> rows = reader.read(file, null, "/p");

    // Then
    assertThat(rows)
        .containsExactly(
            List.of("Quarter", "Growth"), List.of("Q1", "12"), List.of("Q2, late", "9"));
  }

  @Test
  @DisplayName("the intermediate XHTML goes through the hardened document loader")
  void shouldParseXhtml_withSharedDocumentLoader() throws Exception {
    // Given
    XmlDocumentLoader loader = spy(new XmlDocumentLoader());
    Path file = Files.writeString(tempDir.resolve("one.csv"), "a,b\n");

    // When
    List<List<String>> rows = new CsvTabularDataReader(loader).read(file, null, "/p");

    // Then
    assertThat(rows).containsExactly(List.of("a", "b"));
    verify(loader).load(any());
  }
}
