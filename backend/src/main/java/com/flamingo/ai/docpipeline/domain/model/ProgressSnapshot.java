package com.flamingo.ai.docpipeline.domain.model;

import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import java.time.Instant;

/**
 * Point-in-time copy of a progress record.
 *
 * @param estimatedSecondsRemaining null until at least one unit has been processed
 */
public record ProgressSnapshot(
    String jobId,
    int totalUnits,
    int processedUnits,
    JobStatus status,
    double percentage,
    Double estimatedSecondsRemaining,
    Instant startTime,
    Instant lastUpdate,
    String errorMessage) {

  /** Rounded percentage, the granularity at which streams report changes. */
  public long roundedPercentage() {
    return Math.round(percentage);
  }
}
