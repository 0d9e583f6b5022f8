package com.flamingo.ai.docpipeline.service.job;

import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.ChunkAnalysis;
import com.flamingo.ai.docpipeline.domain.model.ChunkResult;
import com.flamingo.ai.docpipeline.domain.model.Job;
import com.flamingo.ai.docpipeline.domain.model.JobSnapshot;
import com.flamingo.ai.docpipeline.domain.store.JobStore;
import com.flamingo.ai.docpipeline.exception.JobNotFoundException;
import com.flamingo.ai.docpipeline.exception.JobNotReadyException;
import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisProvider.AnalysisContext;
import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisService;
import com.flamingo.ai.docpipeline.service.progress.ProgressTracker;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle of chunked jobs.
 *
 * <p>Chunks run concurrently on {@code chunkProcessingExecutor} and may finish in any order. Each
 * outcome is recorded atomically on the {@link Job}; the one recording that completes the count
 * finalizes the job, so finalization runs exactly once. A failed chunk turns the job into {@code
 * error} while the results of its siblings are kept.
 */
@Service
@Slf4j
public class JobOrchestrator {

  private final JobStore jobStore;
  private final ChunkAnalysisService chunkAnalysisService;
  private final ProgressTracker progressTracker;
  private final WorkspaceStorage workspaceStorage;
  private final Executor chunkExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public JobOrchestrator(
      JobStore jobStore,
      ChunkAnalysisService chunkAnalysisService,
      ProgressTracker progressTracker,
      WorkspaceStorage workspaceStorage,
      @Qualifier("chunkProcessingExecutor") Executor chunkExecutor,
      MeterRegistry meterRegistry) {
    this(
        jobStore,
        chunkAnalysisService,
        progressTracker,
        workspaceStorage,
        chunkExecutor,
        meterRegistry,
        Clock.systemUTC());
  }

  public JobOrchestrator(
      JobStore jobStore,
      ChunkAnalysisService chunkAnalysisService,
      ProgressTracker progressTracker,
      WorkspaceStorage workspaceStorage,
      Executor chunkExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.jobStore = jobStore;
    this.chunkAnalysisService = chunkAnalysisService;
    this.progressTracker = progressTracker;
    this.workspaceStorage = workspaceStorage;
    this.chunkExecutor = chunkExecutor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Registers a job for a set of chunks. Nothing runs until the chunks are submitted.
   *
   * @param workDir directory holding the chunk files, released on finalization; may be null
   * @return the new job id
   */
  public String createJob(String fileName, int totalPages, List<Chunk> chunks, Path workDir) {
    return createJob(UUID.randomUUID().toString(), fileName, totalPages, chunks, workDir);
  }

  /** Registers a job under an id chosen by the caller. */
  public String createJob(
      String jobId, String fileName, int totalPages, List<Chunk> chunks, Path workDir) {
    Job job = new Job(jobId, fileName, totalPages, chunks, workDir, clock.instant());
    jobStore.save(job);
    progressTracker.start(jobId, chunks.size());
    log.info(
        "Created job {} for '{}': {} pages in {} chunks",
        jobId,
        fileName,
        totalPages,
        chunks.size());
    return jobId;
  }

  /**
   * Dispatches one chunk for processing and returns immediately. If the executor rejects the
   * chunk it is recorded as failed.
   */
  public void submitChunk(String jobId, Chunk chunk) {
    Job job = findJob(jobId);
    try {
      chunkExecutor.execute(() -> processChunk(job, chunk));
    } catch (RejectedExecutionException e) {
      log.warn("Chunk {} of job {} rejected: {}", chunk.id(), jobId, e.getMessage());
      recordOutcome(job, ChunkResult.failed(chunk, "Processing queue is full"));
    }
  }

  /** Dispatches every chunk of the job. */
  public void submitAll(String jobId) {
    Job job = findJob(jobId);
    for (Chunk chunk : job.getChunks()) {
      submitChunk(jobId, chunk);
    }
  }

  public JobSnapshot getStatus(String jobId) {
    return findJob(jobId).snapshot();
  }

  /**
   * Returns the results of a finished job. Jobs in {@code error} return their partial results.
   *
   * @throws JobNotReadyException while the job is still processing
   */
  public JobSnapshot getResult(String jobId) {
    JobSnapshot snapshot = findJob(jobId).snapshot();
    if (snapshot.status() == JobStatus.PROCESSING) {
      throw new JobNotReadyException(jobId, snapshot.status());
    }
    return snapshot;
  }

  void processChunk(Job job, Chunk chunk) {
    Timer.Sample sample = Timer.start(meterRegistry);
    AnalysisContext context =
        new AnalysisContext(job.getId(), job.getFileName(), job.getTotalPages());
    ChunkResult result;
    try {
      ChunkAnalysis analysis = chunkAnalysisService.analyze(chunk, context);
      result = ChunkResult.success(chunk, analysis);
      log.debug(
          "Chunk {} of job {} done, confidence {}", chunk.id(), job.getId(), analysis.confidence());
    } catch (RuntimeException e) {
      log.warn(
          "Chunk {} (pages {}-{}) of job {} failed: {}",
          chunk.id(),
          chunk.startPage(),
          chunk.endPage(),
          job.getId(),
          e.getMessage());
      result = ChunkResult.failed(chunk, e.getMessage());
    } finally {
      sample.stop(meterRegistry.timer("pipeline_chunk_duration"));
    }
    recordOutcome(job, result);
  }

  private void recordOutcome(Job job, ChunkResult result) {
    boolean completedJob = job.recordChunk(result, clock.instant());
    meterRegistry
        .counter(
            "pipeline_chunks_processed_total", "outcome", result.failed() ? "failure" : "success")
        .increment();

    updateProgress(job, result);
    if (completedJob) {
      finalizeJob(job);
    }
  }

  private void updateProgress(Job job, ChunkResult result) {
    try {
      progressTracker.advance(job.getId(), 1);
      if (result.failed()) {
        progressTracker.fail(job.getId(), job.snapshot().errorMessage());
      }
    } catch (JobNotFoundException e) {
      log.debug("Progress record of job {} already reclaimed", job.getId());
    }
  }

  private void finalizeJob(Job job) {
    JobSnapshot snapshot = job.snapshot();
    for (Chunk chunk : job.getChunks()) {
      workspaceStorage.delete(chunk.file());
    }
    workspaceStorage.release(job.getWorkDir());

    try {
      if (snapshot.status() == JobStatus.COMPLETED) {
        progressTracker.complete(job.getId());
      } else {
        progressTracker.fail(job.getId(), snapshot.errorMessage());
      }
    } catch (JobNotFoundException e) {
      log.debug("Progress record of job {} already reclaimed", job.getId());
    }

    meterRegistry
        .counter("pipeline_jobs_finalized_total", "status", snapshot.status().getValue())
        .increment();
    if (snapshot.status() == JobStatus.COMPLETED) {
      log.info("Job {} completed: {} chunks", job.getId(), snapshot.totalChunks());
    } else {
      log.error("Job {} finished with errors: {}", job.getId(), snapshot.errorMessage());
    }
  }

  /** Removes finished jobs older than the cutoff. */
  public int evictFinishedBefore(Instant cutoff) {
    return jobStore.evictFinishedBefore(cutoff);
  }

  public long activeJobs() {
    return jobStore.countActive();
  }

  private Job findJob(String jobId) {
    return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }
}
