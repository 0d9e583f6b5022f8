package com.flamingo.ai.docpipeline.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_DOCUMENT = "DOCUMENT_001";
  public static final String CONVERSION_FAILED = "DOCUMENT_002";
  public static final String FILE_TOO_LARGE = "RESOURCE_001";
  public static final String CHUNK_TOO_LARGE = "RESOURCE_002";
  public static final String INSUFFICIENT_STORAGE = "RESOURCE_003";
  public static final String QUEUE_FULL = "RESOURCE_004";
  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String JOB_NOT_READY = "JOB_002";
  public static final String DOWNSTREAM_UNAVAILABLE = "DOWNSTREAM_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
