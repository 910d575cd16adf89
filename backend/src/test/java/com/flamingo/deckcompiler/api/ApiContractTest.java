package com.flamingo.deckcompiler.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.deckcompiler.api.rest.DeckController;
import com.flamingo.deckcompiler.api.rest.TemplateController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.multipart.MultipartFile;

/**
 * Contract tests for the REST surface.
 *
 * <ul>
 *   <li>POST /api/decks/compile - Compile a presentation to JSON
 *   <li>POST /api/decks/validate - Compile and summarize
 *   <li>POST /api/templates/inspect - List the layouts of a mapping
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("DeckController API contract")
  class DeckControllerContract {

    @Test
    @DisplayName("should be mapped to /api/decks")
    void shouldBeMappedToApiDecks() {
      RequestMapping mapping = DeckController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/decks");
    }

    @Test
    @DisplayName("should expose compile and validate as POST endpoints")
    void shouldExposeCompileAndValidate() throws Exception {
      PostMapping compile =
          DeckController.class
              .getMethod("compile", MultipartFile.class, MultipartFile.class)
              .getAnnotation(PostMapping.class);
      PostMapping validate =
          DeckController.class
              .getMethod("validate", MultipartFile.class, MultipartFile.class)
              .getAnnotation(PostMapping.class);
      assertThat(compile.value()).containsExactly("/compile");
      assertThat(validate.value()).containsExactly("/validate");
    }
  }

  @Nested
  @DisplayName("TemplateController API contract")
  class TemplateControllerContract {

    @Test
    @DisplayName("should be mapped to /api/templates")
    void shouldBeMappedToApiTemplates() {
      RequestMapping mapping = TemplateController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/templates");
    }
  }
}
