package com.flamingo.deckcompiler.service.compile;

import com.flamingo.deckcompiler.service.model.Presentation;
import com.flamingo.deckcompiler.service.template.TemplateMapping;

/**
 * A resolved presentation together with the mapping it was compiled against.
 *
 * @param presentation slide tree with every link resolved
 * @param mapping template mapping used for layout and placeholder indices
 * @param linksResolved number of label links bound during resolution
 */
public record CompiledDeck(Presentation presentation, TemplateMapping mapping, int linksResolved) {}
