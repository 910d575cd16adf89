package com.flamingo.deckcompiler.service.reference;

import com.flamingo.deckcompiler.exception.LabelException;
import com.flamingo.deckcompiler.service.list.ListEntry;
import com.flamingo.deckcompiler.service.model.LinkSpan;
import com.flamingo.deckcompiler.service.model.ListContent;
import com.flamingo.deckcompiler.service.model.PlaceholderContent;
import com.flamingo.deckcompiler.service.model.PlaceholderNode;
import com.flamingo.deckcompiler.service.model.Presentation;
import com.flamingo.deckcompiler.service.model.SlideNode;
import com.flamingo.deckcompiler.service.model.TableContent;
import com.flamingo.deckcompiler.service.model.TextContent;
import com.flamingo.deckcompiler.service.model.TextRun;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Second pass of label resolution: binds every symbolic link to the slide declaring its label.
 *
 * <p>Labels are collected while the tree is built, so a link may point at a slide that appears
 * later in the document. This pass therefore runs only once the whole presentation exists.
 */
@Component
@Slf4j
public class ForwardReferenceResolver {

  /**
   * Resolves the links of {@code presentation} in place.
   *
   * @return the number of links that were resolved
   * @throws LabelException with {@code UNRESOLVED_LABEL} for the first link, in document order,
   *     whose label no slide declares
   */
  public int resolve(Presentation presentation) {
    Map<String, Integer> labels = presentation.labels();
    int resolved = 0;
    for (SlideNode slide : presentation.slides()) {
      for (PlaceholderNode placeholder : slide.placeholders()) {
        for (TextRun run : runsOf(placeholder)) {
          for (LinkSpan link : run.links()) {
            if (!link.isSymbolic() || link.isResolved()) {
              continue;
            }
            Integer target = labels.get(link.label());
            if (target == null) {
              throw LabelException.unresolved(link.label(), link.nodePath());
            }
            link.resolveTo(target);
            resolved++;
          }
        }
      }
    }
    log.debug("Resolved {} slide links against {} labels", resolved, labels.size());
    return resolved;
  }

  private static List<TextRun> runsOf(PlaceholderNode placeholder) {
    PlaceholderContent content = placeholder.content();
    return switch (placeholder.kind()) {
      case TEXT -> List.of(((TextContent) content).run());
      case IMAGE -> List.of();
      case TABLE -> ((TableContent) content).spec().rows().stream().flatMap(List::stream).toList();
      case LIST -> ((ListContent) content).entries().map(ListEntry::run).toList();
    };
  }
}
