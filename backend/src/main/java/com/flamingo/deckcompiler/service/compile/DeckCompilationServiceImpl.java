package com.flamingo.deckcompiler.service.compile;

import com.flamingo.deckcompiler.config.CompilerConfig;
import com.flamingo.deckcompiler.exception.DeckCompilationException;
import com.flamingo.deckcompiler.exception.MalformedDocumentException;
import com.flamingo.deckcompiler.service.build.ContentTreeBuilder;
import com.flamingo.deckcompiler.service.importer.TabularDataSource;
import com.flamingo.deckcompiler.service.model.Presentation;
import com.flamingo.deckcompiler.service.reference.ForwardReferenceResolver;
import com.flamingo.deckcompiler.service.table.TableLayoutEngine;
import com.flamingo.deckcompiler.service.template.TemplateMapping;
import com.flamingo.deckcompiler.service.template.TemplateMappingParser;
import com.flamingo.deckcompiler.service.writer.PresentationWriter;
import com.flamingo.deckcompiler.service.xml.XmlDocumentLoader;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

/**
 * Implementation of the DeckCompilationService.
 *
 * <p>Stateless: each compilation gets its own {@link ContentTreeBuilder}, which owns the scope
 * engine and label table for that run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeckCompilationServiceImpl implements DeckCompilationService {

  private final XmlDocumentLoader xmlDocumentLoader;
  private final TemplateMappingParser templateMappingParser;
  private final TableLayoutEngine tableLayoutEngine;
  private final TabularDataSource tabularDataSource;
  private final ForwardReferenceResolver forwardReferenceResolver;
  private final PresentationWriter presentationWriter;
  private final CompilerConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  public TemplateMapping loadMapping(InputStream mapping) {
    return templateMappingParser.parse(mapping);
  }

  @Override
  @Timed(value = "deck.compile", description = "Time to compile a presentation document")
  public CompiledDeck compile(InputStream presentation, InputStream mapping) {
    long start = System.nanoTime();
    try {
      TemplateMapping templateMapping = loadMapping(mapping);
      Document document = loadPresentation(presentation);

      ContentTreeBuilder builder =
          new ContentTreeBuilder(templateMapping, tabularDataSource, tableLayoutEngine, config);
      Presentation tree = builder.build(document);
      int links = forwardReferenceResolver.resolve(tree);

      meterRegistry.counter("deck_compilations_total", "outcome", "success").increment();
      meterRegistry.counter("deck_slides_compiled_total").increment(tree.slides().size());
      log.info(
          "Compiled presentation: {} slides, {} labels, {} links resolved in {} ms",
          tree.slides().size(),
          tree.labels().size(),
          links,
          (System.nanoTime() - start) / 1_000_000);
      return new CompiledDeck(tree, templateMapping, links);
    } catch (DeckCompilationException e) {
      meterRegistry
          .counter(
              "deck_compilations_total",
              "outcome",
              e.getErrorCode().name().toLowerCase(Locale.ROOT))
          .increment();
      throw e;
    }
  }

  @Override
  public void write(CompiledDeck deck, OutputStream out) throws IOException {
    presentationWriter.write(deck.presentation(), deck.mapping(), out);
  }

  private Document loadPresentation(InputStream presentation) {
    try {
      return xmlDocumentLoader.load(presentation);
    } catch (SAXException | IOException e) {
      throw new MalformedDocumentException(
          "Presentation document is not well-formed XML: " + e.getMessage(), e);
    }
  }
}
