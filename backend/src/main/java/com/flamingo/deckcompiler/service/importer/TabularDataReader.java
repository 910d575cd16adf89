package com.flamingo.deckcompiler.service.importer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads every row of a tabular file as cell strings.
 *
 * <p>Implementations are format-specific and stateless. Selection of rows and columns is applied
 * afterwards by {@link TabularDataSource}.
 */
public interface TabularDataReader {

  /**
   * Returns {@code true} if this reader handles the given file name, judged by extension.
   *
   * @param fileName file name as written in the document
   * @return {@code true} if supported
   */
  boolean supports(String fileName);

  /**
   * Reads all rows of the file.
   *
   * @param file file to read
   * @param sheet sheet name for multi-sheet formats, null for the first sheet
   * @param nodePath path of the {@code <import>} element, for error reporting
   * @return rows of cell text; rows may differ in length
   * @throws IOException if the file cannot be read
   */
  List<List<String>> read(Path file, String sheet, String nodePath) throws IOException;
}
