package com.flamingo.deckcompiler.service.importer;

import com.flamingo.deckcompiler.config.CompilerConfig;
import com.flamingo.deckcompiler.exception.TabularImportException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Supplies table rows for {@code <import>} elements.
 *
 * <p>Routes the file to the first {@link TabularDataReader} that supports its extension (readers
 * are injected in {@code @Order} order), then applies the row and column selections. Files must
 * lie inside the configured import directory. Imported rows are plain cell strings; the builder
 * turns them into ordinary table rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TabularDataSource {

  private final List<TabularDataReader> readers;
  private final CompilerConfig config;

  /**
   * Reads the rows an import asks for.
   *
   * @param request file and selections from the {@code <import>} element
   * @param nodePath path of the {@code <import>} element
   * @return selected rows, each holding the selected columns
   * @throws TabularImportException if importing is disabled, the file is missing, unsupported or
   *     outside the import directory, or a selection is invalid
   */
  public List<List<String>> read(ImportRequest request, String nodePath) {
    CompilerConfig.Import settings = config.getImporting();
    if (!settings.isEnabled()) {
      throw new TabularImportException("Tabular imports are disabled", nodePath);
    }
    if (request.fileName() == null || request.fileName().isBlank()) {
      throw new TabularImportException("<import> names no file", nodePath);
    }

    RangeSelection rowSelection = RangeSelection.parse(request.rows(), nodePath);
    RangeSelection colSelection = RangeSelection.parse(request.cols(), nodePath);

    TabularDataReader reader =
        readers.stream()
            .filter(r -> r.supports(request.fileName()))
            .findFirst()
            .orElseThrow(
                () ->
                    new TabularImportException(
                        "Unsupported import format: " + request.fileName(), nodePath));

    Path base = Path.of(settings.getBaseDirectory()).toAbsolutePath().normalize();
    Path file;
    try {
      file = base.resolve(request.fileName()).normalize();
    } catch (InvalidPathException e) {
      throw new TabularImportException(
          "Invalid import file name: " + request.fileName(), nodePath, e);
    }
    if (!file.startsWith(base)) {
      throw new TabularImportException(
          "Import file is outside the import directory: " + request.fileName(), nodePath);
    }
    if (!Files.isRegularFile(file)) {
      throw new TabularImportException("Import file not found: " + file, nodePath);
    }

    List<List<String>> rows;
    try {
      rows = reader.read(file, request.sheet(), nodePath);
    } catch (IOException e) {
      throw new TabularImportException(
          "Failed to read " + request.fileName() + ": " + e.getMessage(), nodePath, e);
    }

    int width = rows.stream().mapToInt(List::size).max().orElse(0);
    List<List<String>> selected =
        rowSelection.selectStrict(rows, nodePath).stream()
            .map(cells -> colSelection.selectWithin(cells, width, ""))
            .toList();
    log.debug("Imported {} rows from {} for {}", selected.size(), file, nodePath);
    return selected;
  }
}
