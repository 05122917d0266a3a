package com.flamingo.ai.stripsequencer.exception;

/** Exception thrown when a sequencing run is requested with no segments. */
public class EmptyInputException extends RuntimeException {

  private final String userMessage;

  public EmptyInputException(String message) {
    super(message);
    this.userMessage = "Nothing to order. Upload at least one image.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
