package com.flamingo.ai.docpipeline.domain.model;

import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/**
 * A chunked processing job. Chunk outcomes arrive concurrently; every read-modify-write of the
 * counters happens under the job's monitor so the completion check and the increment are one step.
 */
public class Job {

  @Getter private final String id;
  @Getter private final String fileName;
  @Getter private final int totalPages;
  @Getter private final Instant createdAt;

  /** Directory holding the chunk files, released when the job is finalized. */
  @Getter private final Path workDir;

  private final List<Chunk> chunks;

  private final List<ChunkResult> results = new ArrayList<>();
  private final Set<String> recordedChunkIds = new HashSet<>();
  private JobStatus status = JobStatus.PROCESSING;
  private int completedChunks;
  private String errorMessage;
  private Instant finishedAt;

  public Job(
      String id,
      String fileName,
      int totalPages,
      List<Chunk> chunks,
      Path workDir,
      Instant createdAt) {
    if (chunks.isEmpty()) {
      throw new IllegalArgumentException("A job needs at least one chunk");
    }
    this.id = id;
    this.fileName = fileName;
    this.totalPages = totalPages;
    this.chunks = List.copyOf(chunks);
    this.workDir = workDir;
    this.createdAt = createdAt;
  }

  public List<Chunk> getChunks() {
    return chunks;
  }

  public int getTotalChunks() {
    return chunks.size();
  }

  /**
   * Records the outcome of one chunk.
   *
   * <p>A failed chunk moves the job to {@link JobStatus#ERROR} immediately; results of other chunks
   * keep accumulating. When the count first reaches the total the results are sorted by start page
   * and a still-processing job becomes {@link JobStatus#COMPLETED}.
   *
   * @return true for exactly one call: the one that completed the job
   */
  public synchronized boolean recordChunk(ChunkResult result, Instant now) {
    if (chunks.stream().noneMatch(chunk -> chunk.id().equals(result.chunkId()))) {
      throw new IllegalArgumentException("Chunk " + result.chunkId() + " is not part of job " + id);
    }
    if (!recordedChunkIds.add(result.chunkId())) {
      return false;
    }
    results.add(result);
    completedChunks++;

    if (result.failed() && status == JobStatus.PROCESSING) {
      status = JobStatus.ERROR;
      errorMessage =
          "Chunk "
              + result.chunkId()
              + " (pages "
              + result.startPage()
              + "-"
              + result.endPage()
              + ") failed: "
              + result.error();
    }

    if (completedChunks < chunks.size()) {
      return false;
    }
    results.sort(Comparator.comparingInt(ChunkResult::startPage));
    if (status == JobStatus.PROCESSING) {
      status = JobStatus.COMPLETED;
    }
    finishedAt = now;
    return true;
  }

  public synchronized JobSnapshot snapshot() {
    List<ChunkResult> ordered = new ArrayList<>(results);
    ordered.sort(Comparator.comparingInt(ChunkResult::startPage));
    return new JobSnapshot(
        id,
        fileName,
        status,
        totalPages,
        chunks.size(),
        completedChunks,
        ordered,
        errorMessage,
        createdAt,
        finishedAt);
  }

  public synchronized JobStatus getStatus() {
    return status;
  }

  public synchronized Instant getFinishedAt() {
    return finishedAt;
  }
}
