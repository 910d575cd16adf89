package com.flamingo.deckcompiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Main entry point for the Deck Compiler service. */
@SpringBootApplication
public class DeckCompilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeckCompilerApplication.class, args);
  }
}
