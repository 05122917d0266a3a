package com.flamingo.ai.stripsequencer.exception;

/** Exception thrown when an upload cannot be accepted as an image. */
public class InvalidUploadException extends RuntimeException {

  private final String fileName;

  public InvalidUploadException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public InvalidUploadException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }

  /** Message shown to the client; identical to the exception message. */
  public String getUserMessage() {
    return getMessage();
  }
}
