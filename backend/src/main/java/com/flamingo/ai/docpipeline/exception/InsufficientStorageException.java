package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when the work volume lacks space for the next write. */
public class InsufficientStorageException extends ResourceExhaustedException {

  public InsufficientStorageException(long requiredBytes, long availableBytes) {
    super(
        "Insufficient storage: need " + requiredBytes + " bytes, " + availableBytes + " available",
        requiredBytes,
        availableBytes);
  }

  @Override
  public String getUserMessage() {
    return "Insufficient storage space to process the document";
  }
}
