package com.flamingo.deckcompiler.service.compile;

import com.flamingo.deckcompiler.service.template.TemplateMapping;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/** Service interface for compiling presentation documents. */
public interface DeckCompilationService {

  /**
   * Parses a template mapping document.
   *
   * @param mapping the mapping XML
   * @return the loaded mapping
   * @throws com.flamingo.deckcompiler.exception.TemplateMappingException if the mapping is invalid
   */
  TemplateMapping loadMapping(InputStream mapping);

  /**
   * Compiles a presentation document against a template mapping.
   *
   * @param presentation the presentation XML
   * @param mapping the mapping XML
   * @return the resolved deck
   * @throws com.flamingo.deckcompiler.exception.DeckCompilationException on the first error in
   *     document order
   */
  CompiledDeck compile(InputStream presentation, InputStream mapping);

  /**
   * Serializes a compiled deck with the configured writer.
   *
   * @param deck the compiled deck
   * @param out destination, flushed but not closed
   * @throws IOException if writing fails
   */
  void write(CompiledDeck deck, OutputStream out) throws IOException;
}
