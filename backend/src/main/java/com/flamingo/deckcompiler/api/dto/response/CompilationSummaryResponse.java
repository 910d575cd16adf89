package com.flamingo.deckcompiler.api.dto.response;

import com.flamingo.deckcompiler.service.compile.CompiledDeck;
import com.flamingo.deckcompiler.service.model.SlideNode;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a successful validation run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompilationSummaryResponse {

  private int slideCount;
  private int linksResolved;
  private Map<String, Integer> labels;
  private List<String> slideLayouts;

  /** Creates a summary from a compiled deck. */
  public static CompilationSummaryResponse fromDeck(CompiledDeck deck) {
    return CompilationSummaryResponse.builder()
        .slideCount(deck.presentation().slides().size())
        .linksResolved(deck.linksResolved())
        .labels(deck.presentation().labels())
        .slideLayouts(
            deck.presentation().slides().stream().map(s -> s.layout().name()).toList())
        .build();
  }
}
