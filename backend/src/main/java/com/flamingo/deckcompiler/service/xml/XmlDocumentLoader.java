package com.flamingo.deckcompiler.service.xml;

import java.io.IOException;
import java.io.InputStream;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Loads XML documents into a DOM with external entities and DTDs disabled.
 *
 * <p>Callers translate {@link SAXException} into the failure of the document they were loading
 * (mapping or presentation).
 */
@Component
@Slf4j
public class XmlDocumentLoader {

  public Document load(InputStream inputStream) throws SAXException, IOException {
    DocumentBuilder builder;
    try {
      builder = newFactory().newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
    builder.setErrorHandler(
        new ErrorHandler() {
          @Override
          public void warning(SAXParseException exception) {
            log.debug(
                "XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
          }

          @Override
          public void error(SAXParseException exception) throws SAXException {
            throw exception;
          }

          @Override
          public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
          }
        });
    Document document = builder.parse(inputStream);
    document.getDocumentElement().normalize();
    return document;
  }

  private DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    dbf.setExpandEntityReferences(false);
    dbf.setNamespaceAware(true);
    dbf.setCoalescing(true);
    return dbf;
  }
}
