package com.flamingo.deckcompiler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for deck compilation. */
@Configuration
@ConfigurationProperties(prefix = "deck")
@Validated
@Getter
@Setter
public class CompilerConfig {

  @Valid private Text text = new Text();
  @Valid private Table table = new Table();
  @Valid private Import importing = new Import();
  @Valid private Output output = new Output();

  @Getter
  @Setter
  public static class Text {
    /** Pattern recorded on {@code <date/>} elements that do not declare a format. */
    @NotBlank private String defaultDatePattern = "MMMM dd, yyyy";
  }

  @Getter
  @Setter
  public static class Table {
    /** Weight of columns and rows that declare none. */
    @Positive private double defaultWeight = 1.0;
  }

  /** Tabular data imported into tables with {@code <import>}. */
  @Getter
  @Setter
  public static class Import {
    private boolean enabled = true;

    /** Directory that import file names are resolved against. */
    @NotBlank private String baseDirectory = ".";
  }

  @Getter
  @Setter
  public static class Output {
    private boolean prettyPrint = true;
  }
}
