package com.flamingo.deckcompiler.api.rest;

import com.flamingo.deckcompiler.api.dto.response.LayoutResponse;
import com.flamingo.deckcompiler.service.compile.DeckCompilationService;
import com.flamingo.deckcompiler.service.template.TemplateMapping;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for template mappings. */
@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class TemplateController {

  private final DeckCompilationService deckCompilationService;

  /** Validates a mapping and lists its layouts and placeholders. */
  @PostMapping(value = "/inspect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<List<LayoutResponse>> inspect(
      @RequestParam("mapping") MultipartFile mapping) throws IOException {
    TemplateMapping templateMapping;
    try (InputStream in = mapping.getInputStream()) {
      templateMapping = deckCompilationService.loadMapping(in);
    }
    return ResponseEntity.ok(
        templateMapping.layouts().stream().map(LayoutResponse::fromLayout).toList());
  }
}
