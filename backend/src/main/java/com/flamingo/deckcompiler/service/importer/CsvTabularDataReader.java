package com.flamingo.deckcompiler.service.importer;

import com.flamingo.deckcompiler.service.xml.DomElements;
import com.flamingo.deckcompiler.service.xml.XmlDocumentLoader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.csv.TextAndCSVParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link TabularDataReader} for comma-separated files.
 *
 * <p>Uses Apache Tika's {@link TextAndCSVParser} with a {@link ToXMLContentHandler} to produce an
 * XHTML table, then walks its {@code <tr>} and {@code <td>} elements. The XHTML is parsed by the
 * same hardened {@link XmlDocumentLoader} that reads presentations.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class CsvTabularDataReader implements TabularDataReader {

  private static final String CSV_CONTENT_TYPE = "text/csv; charset=UTF-8; delimiter=comma";

  private final XmlDocumentLoader xmlDocumentLoader;

  @Override
  public boolean supports(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".csv");
  }

  @Override
  public List<List<String>> read(Path file, String sheet, String nodePath) throws IOException {
    byte[] xhtml;
    try (InputStream in = Files.newInputStream(file)) {
      xhtml = toXhtml(in);
    } catch (SAXException | TikaException e) {
      throw new IOException("Failed to parse CSV " + file.getFileName() + ": " + e.getMessage(), e);
    }

    Document dom;
    try {
      dom = xmlDocumentLoader.load(new ByteArrayInputStream(xhtml));
    } catch (SAXException e) {
      throw new IOException("Unreadable CSV table for " + file.getFileName(), e);
    }
    List<List<String>> rows = new ArrayList<>();
    NodeList tableRows = dom.getElementsByTagNameNS("*", "tr");
    for (int r = 0; r < tableRows.getLength(); r++) {
      rows.add(cellsOf((Element) tableRows.item(r)));
    }
    log.debug("Read {} rows from {}", rows.size(), file);
    return rows;
  }

  private byte[] toXhtml(InputStream in) throws IOException, SAXException, TikaException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(TikaCoreProperties.CONTENT_TYPE_USER_OVERRIDE, CSV_CONTENT_TYPE);
    new TextAndCSVParser().parse(in, handler, metadata, new ParseContext());
    return out.toByteArray();
  }

  private List<String> cellsOf(Element row) {
    List<String> cells = new ArrayList<>();
    for (Element cell : DomElements.childElements(row)) {
      String tag = DomElements.nameOf(cell);
      if ("td".equalsIgnoreCase(tag) || "th".equalsIgnoreCase(tag)) {
        cells.add(cell.getTextContent().trim());
      }
    }
    return cells;
  }
}
