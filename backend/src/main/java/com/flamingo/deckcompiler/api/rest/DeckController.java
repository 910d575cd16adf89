package com.flamingo.deckcompiler.api.rest;

import com.flamingo.deckcompiler.api.dto.response.CompilationSummaryResponse;
import com.flamingo.deckcompiler.service.compile.CompiledDeck;
import com.flamingo.deckcompiler.service.compile.DeckCompilationService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for compiling presentation documents. */
@RestController
@RequestMapping("/api/decks")
@RequiredArgsConstructor
public class DeckController {

  private final DeckCompilationService deckCompilationService;

  /** Compiles a presentation against a mapping and returns the resolved tree as JSON. */
  @PostMapping(
      value = "/compile",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<byte[]> compile(
      @RequestParam("presentation") MultipartFile presentation,
      @RequestParam("mapping") MultipartFile mapping)
      throws IOException {
    CompiledDeck deck = compileParts(presentation, mapping);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    deckCompilationService.write(deck, out);
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(out.toByteArray());
  }

  /** Compiles without serializing and reports what the deck contains. */
  @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<CompilationSummaryResponse> validate(
      @RequestParam("presentation") MultipartFile presentation,
      @RequestParam("mapping") MultipartFile mapping)
      throws IOException {
    CompiledDeck deck = compileParts(presentation, mapping);
    return ResponseEntity.ok(CompilationSummaryResponse.fromDeck(deck));
  }

  private CompiledDeck compileParts(MultipartFile presentation, MultipartFile mapping)
      throws IOException {
    try (InputStream presentationIn = presentation.getInputStream();
        InputStream mappingIn = mapping.getInputStream()) {
      return deckCompilationService.compile(presentationIn, mappingIn);
    }
  }
}
