package com.flamingo.deckcompiler.service.importer;

import com.flamingo.deckcompiler.exception.TabularImportException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link TabularDataReader} for Excel workbooks, backed by Apache POI.
 *
 * <p>Cells are rendered with {@link DataFormatter}, so numbers and dates appear as Excel displays
 * them. Empty rows inside the used range become empty rows.
 */
@Component
@Order(1)
@Slf4j
public class XlsxTabularDataReader implements TabularDataReader {

  @Override
  public boolean supports(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".xlsx");
  }

  @Override
  public List<List<String>> read(Path file, String sheetName, String nodePath) throws IOException {
    try (InputStream in = Files.newInputStream(file);
        XSSFWorkbook workbook = new XSSFWorkbook(in)) {
      Sheet sheet = sheetName == null ? workbook.getSheetAt(0) : workbook.getSheet(sheetName);
      if (sheet == null) {
        throw new TabularImportException(
            "Workbook " + file.getFileName() + " has no sheet named \"" + sheetName + "\"",
            nodePath);
      }

      DataFormatter formatter = new DataFormatter(Locale.ROOT);
      List<List<String>> rows = new ArrayList<>();
      for (int r = 0; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        List<String> cells = new ArrayList<>();
        if (row != null) {
          for (int c = 0; c < Math.max(row.getLastCellNum(), 0); c++) {
            Cell cell = row.getCell(c);
            cells.add(cell == null ? "" : formatter.formatCellValue(cell));
          }
        }
        rows.add(cells);
      }
      log.debug("Read {} rows from sheet \"{}\" of {}", rows.size(), sheet.getSheetName(), file);
      return rows;
    }
  }
}
