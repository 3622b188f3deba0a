package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when generated text does not follow the required citation format. */
public class GenerationFormatException extends RuntimeException {

  private final String rawOutput;

  public GenerationFormatException(String message, String rawOutput) {
    super(message);
    this.rawOutput = rawOutput;
  }

  public String getRawOutput() {
    return rawOutput;
  }
}
