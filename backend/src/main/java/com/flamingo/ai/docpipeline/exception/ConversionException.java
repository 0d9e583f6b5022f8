package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when an external conversion or OCR tool fails or produces unusable output. */
public class ConversionException extends RuntimeException {

  private final String tool;
  private final String userMessage;

  public ConversionException(String tool, String message) {
    super(message);
    this.tool = tool;
    this.userMessage = "Failed to convert document";
  }

  public ConversionException(String tool, String message, Throwable cause) {
    super(message, cause);
    this.tool = tool;
    this.userMessage = "Failed to convert document";
  }

  public String getTool() {
    return tool;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
