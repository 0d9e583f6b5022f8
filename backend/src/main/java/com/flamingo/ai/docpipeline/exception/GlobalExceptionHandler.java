package com.flamingo.ai.docpipeline.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidDocumentException.class)
  public ResponseEntity<ApiError> handleInvalidDocument(
      InvalidDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_document");
    String errorId = generateErrorId();
    log.warn("Invalid document [{}] {}: {}", errorId, ex.getFileName(), ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_DOCUMENT, ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(FileTooLargeException.class)
  public ResponseEntity<ApiError> handleFileTooLarge(
      FileTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("file_too_large");
    String errorId = generateErrorId();
    log.warn("File too large [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.FILE_TOO_LARGE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("file_too_large");
    String errorId = generateErrorId();
    log.warn("Multipart limit exceeded [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.FILE_TOO_LARGE,
        "File exceeds maximum upload size",
        request);
  }

  @ExceptionHandler(ChunkTooLargeException.class)
  public ResponseEntity<ApiError> handleChunkTooLarge(
      ChunkTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("chunk_too_large");
    String errorId = generateErrorId();
    log.warn("Chunk too large [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.CHUNK_TOO_LARGE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(InsufficientStorageException.class)
  public ResponseEntity<ApiError> handleInsufficientStorage(
      InsufficientStorageException ex, HttpServletRequest request) {

    incrementErrorCounter("insufficient_storage");
    String errorId = generateErrorId();
    log.error("Insufficient storage [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.INSUFFICIENT_STORAGE,
        errorId,
        ApiError.INSUFFICIENT_STORAGE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ApiError> handleQueueFull(
      TaskRejectedException ex, HttpServletRequest request) {

    incrementErrorCounter("queue_full");
    String errorId = generateErrorId();
    log.warn("Work queue full [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.QUEUE_FULL,
        "Server is busy. Please try again later.",
        request);
  }

  @ExceptionHandler(ConversionException.class)
  public ResponseEntity<ApiError> handleConversion(
      ConversionException ex, HttpServletRequest request) {

    incrementErrorCounter("conversion_failed");
    String errorId = generateErrorId();
    log.error("Conversion failed [{}] ({}): {}", errorId, ex.getTool(), ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.CONVERSION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(DownstreamUnavailableException.class)
  public ResponseEntity<ApiError> handleDownstreamUnavailable(
      DownstreamUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("downstream_unavailable");
    String errorId = generateErrorId();
    log.error("Dependency {} unavailable [{}]: {}", ex.getDependency(), errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.DOWNSTREAM_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler(JobNotReadyException.class)
  public ResponseEntity<ApiError> handleJobNotReady(
      JobNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_ready");
    String errorId = generateErrorId();
    log.debug("Job not ready [{}]: {}", errorId, ex.getJobId());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.JOB_NOT_READY,
        "Job is still " + ex.getStatus().getValue(),
        request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation");
    String errorId = generateErrorId();
    log.warn("Missing request input [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(),
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(),
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGenericException(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
