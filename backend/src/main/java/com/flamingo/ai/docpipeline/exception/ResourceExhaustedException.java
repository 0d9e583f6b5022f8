package com.flamingo.ai.docpipeline.exception;

/**
 * Base class for failures caused by a hard resource limit. Callers are expected to back off rather
 * than retry immediately.
 */
public abstract class ResourceExhaustedException extends RuntimeException {

  private final long requiredBytes;
  private final long limitBytes;

  protected ResourceExhaustedException(String message, long requiredBytes, long limitBytes) {
    super(message);
    this.requiredBytes = requiredBytes;
    this.limitBytes = limitBytes;
  }

  public long getRequiredBytes() {
    return requiredBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }

  public abstract String getUserMessage();
}
