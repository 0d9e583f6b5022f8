package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when an uploaded file exceeds the configured size limit. */
public class FileTooLargeException extends ResourceExhaustedException {

  public FileTooLargeException(long sizeBytes, long maxBytes) {
    super(
        "File size " + sizeBytes + " exceeds limit of " + maxBytes + " bytes", sizeBytes, maxBytes);
  }

  @Override
  public String getUserMessage() {
    return "File exceeds maximum size of " + (getLimitBytes() / (1024 * 1024)) + "MB";
  }
}
