package com.flamingo.deckcompiler.api.dto.response;

import com.flamingo.deckcompiler.service.template.LayoutDef;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing one layout of a template mapping. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutResponse {

  private String name;
  private int index;
  private Map<String, Integer> placeholders;

  /** Creates a LayoutResponse from a layout definition. */
  public static LayoutResponse fromLayout(LayoutDef layout) {
    return LayoutResponse.builder()
        .name(layout.name())
        .index(layout.index())
        .placeholders(layout.placeholders())
        .build();
  }
}
