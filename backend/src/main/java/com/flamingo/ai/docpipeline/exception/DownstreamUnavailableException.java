package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when a guarded dependency is unavailable (breaker open or call timed out). */
public class DownstreamUnavailableException extends RuntimeException {

  private final String dependency;

  public DownstreamUnavailableException(String dependency, String message) {
    super(message);
    this.dependency = dependency;
  }

  public DownstreamUnavailableException(String dependency, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
  }

  public String getDependency() {
    return dependency;
  }

  public String getUserMessage() {
    return "A processing dependency is temporarily unavailable. Please try again later.";
  }
}
