package com.flamingo.ai.stripsequencer.exception;

/** Exception thrown when a distance oracle cannot compute a distance. */
public class DistanceComputationException extends RuntimeException {

  private final String userMessage;

  public DistanceComputationException(String message) {
    super(message);
    this.userMessage = "Semantic comparison is temporarily unavailable. Please try again.";
  }

  public DistanceComputationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Semantic comparison is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
