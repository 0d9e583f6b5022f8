package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when an input is not a readable PDF or is otherwise unacceptable. */
public class InvalidDocumentException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public InvalidDocumentException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.userMessage = message;
  }

  public InvalidDocumentException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = message;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
