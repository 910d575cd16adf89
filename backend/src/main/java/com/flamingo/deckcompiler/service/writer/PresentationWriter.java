package com.flamingo.deckcompiler.service.writer;

import com.flamingo.deckcompiler.service.model.Presentation;
import com.flamingo.deckcompiler.service.template.TemplateMapping;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Serializes a resolved presentation.
 *
 * <p>Receives the tree only after every link is resolved. Layout and placeholder indices come from
 * the mapping; a container writer checks them against its skeleton file.
 */
public interface PresentationWriter {

  /**
   * Writes {@code presentation} to {@code out}. The stream is flushed but not closed.
   *
   * @param presentation resolved slide tree
   * @param mapping the mapping the tree was compiled against
   * @param out destination
   * @throws IOException if writing fails
   */
  void write(Presentation presentation, TemplateMapping mapping, OutputStream out)
      throws IOException;
}
