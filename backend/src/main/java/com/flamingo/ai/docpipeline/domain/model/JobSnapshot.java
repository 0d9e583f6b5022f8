package com.flamingo.ai.docpipeline.domain.model;

import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import java.time.Instant;
import java.util.List;

/** Immutable point-in-time view of a {@link Job}. */
public record JobSnapshot(
    String jobId,
    String fileName,
    JobStatus status,
    int totalPages,
    int totalChunks,
    int completedChunks,
    List<ChunkResult> results,
    String errorMessage,
    Instant createdAt,
    Instant finishedAt) {

  public JobSnapshot {
    results = List.copyOf(results);
  }

  public double percentage() {
    return totalChunks == 0 ? 0.0 : completedChunks * 100.0 / totalChunks;
  }

  /** Mean confidence of the successful chunks, 0 when none succeeded. */
  public double confidence() {
    return results.stream()
        .filter(r -> !r.failed())
        .mapToDouble(ChunkResult::confidence)
        .average()
        .orElse(0.0);
  }
}
