package com.flamingo.ai.docpipeline.domain.model;

import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import java.time.Duration;
import java.time.Instant;

/**
 * Mutable progress counters for one job. Only the job's own processing path writes to it; readers
 * take snapshots.
 */
public class ProgressState {

  /** Highest percentage reported while a job is not yet completed. */
  static final double MAX_UNFINISHED_PERCENTAGE = 99.0;

  private final String jobId;
  private final Instant startTime;
  private int totalUnits;
  private int processedUnits;
  private JobStatus status = JobStatus.PROCESSING;
  private Instant lastUpdate;
  private String errorMessage;

  public ProgressState(String jobId, int totalUnits, Instant startTime) {
    this.jobId = jobId;
    this.totalUnits = Math.max(0, totalUnits);
    this.startTime = startTime;
    this.lastUpdate = startTime;
  }

  /** Sets the unit total once it is known. Not allowed after units have been counted. */
  public synchronized void setTotalUnits(int totalUnits, Instant now) {
    if (processedUnits > 0) {
      throw new IllegalStateException("Total already in use for job " + jobId);
    }
    this.totalUnits = Math.max(0, totalUnits);
    this.lastUpdate = now;
  }

  public synchronized void advance(int units, Instant now) {
    if (status.isTerminal() || units <= 0) {
      return;
    }
    processedUnits = Math.min(totalUnits, processedUnits + units);
    lastUpdate = now;
  }

  public synchronized void complete(Instant now) {
    if (status.isTerminal()) {
      return;
    }
    processedUnits = totalUnits;
    status = JobStatus.COMPLETED;
    lastUpdate = now;
  }

  public synchronized void fail(String reason, Instant now) {
    if (status.isTerminal()) {
      return;
    }
    status = JobStatus.ERROR;
    errorMessage = reason;
    lastUpdate = now;
  }

  public synchronized ProgressSnapshot snapshot(Instant now) {
    return new ProgressSnapshot(
        jobId,
        totalUnits,
        processedUnits,
        status,
        percentage(processedUnits, totalUnits, status),
        estimateRemainingSeconds(now),
        startTime,
        lastUpdate,
        errorMessage);
  }

  public synchronized Instant getLastUpdate() {
    return lastUpdate;
  }

  public synchronized JobStatus getStatus() {
    return status;
  }

  /** {@code processed / total * 100} clamped to [0,100]; 100 only once completed. */
  static double percentage(int processed, int total, JobStatus status) {
    if (status == JobStatus.COMPLETED) {
      return 100.0;
    }
    if (total <= 0) {
      return 0.0;
    }
    double raw = processed * 100.0 / total;
    return Math.max(0.0, Math.min(MAX_UNFINISHED_PERCENTAGE, raw));
  }

  /** {@code elapsed / processed * remaining}; null before the first unit. */
  private Double estimateRemainingSeconds(Instant now) {
    if (status == JobStatus.COMPLETED) {
      return 0.0;
    }
    if (processedUnits == 0) {
      return null;
    }
    double elapsed = Duration.between(startTime, now).toMillis() / 1000.0;
    int remaining = Math.max(0, totalUnits - processedUnits);
    return elapsed / processedUnits * remaining;
  }
}
