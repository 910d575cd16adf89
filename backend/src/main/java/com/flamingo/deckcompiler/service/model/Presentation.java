package com.flamingo.deckcompiler.service.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The compiled slide tree.
 *
 * @param slides slides in deck order
 * @param labels label to slide index, in declaration order
 */
public record Presentation(List<SlideNode> slides, Map<String, Integer> labels) {

  public Presentation {
    slides = List.copyOf(slides);
    labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
  }

  public SlideNode slide(int index) {
    return slides.get(index);
  }
}
