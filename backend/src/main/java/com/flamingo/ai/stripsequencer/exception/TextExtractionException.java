package com.flamingo.ai.stripsequencer.exception;

/** Exception thrown when text cannot be extracted from an uploaded image. */
public class TextExtractionException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public TextExtractionException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.userMessage = "Text recognition failed for '" + fileName + "'. Please try again later.";
  }

  public TextExtractionException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = "Text recognition failed for '" + fileName + "'. Please try again later.";
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
