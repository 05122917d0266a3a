package com.flamingo.ai.stripsequencer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the strip sequencer backend. */
@SpringBootApplication
public class StripSequencerApplication {

  public static void main(String[] args) {
    SpringApplication.run(StripSequencerApplication.class, args);
  }
}
