package com.flamingo.ai.docpipeline.service.progress;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import com.flamingo.ai.docpipeline.domain.model.ProgressSnapshot;
import com.flamingo.ai.docpipeline.domain.model.ProgressState;
import com.flamingo.ai.docpipeline.exception.JobNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Per-job progress records, readable as snapshots or as a coalesced live stream.
 *
 * <p>A stream polls the record and emits only when the rounded percentage or the status changes,
 * ending after the terminal update. Each stream follows the record it was opened on, so every open
 * stream delivers the completion even if another one purged it first. A completed record is purged
 * when the last stream watching it ends; anything left behind is reclaimed by {@link
 * #evictIdleBefore(Instant)}.
 */
@Service
@Slf4j
public class ProgressTracker {

  private final Map<String, ProgressState> states = new ConcurrentHashMap<>();
  private final Map<String, Integer> openStreams = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration pollInterval;
  private final AtomicReference<Instant> lastCompletedAt = new AtomicReference<>();

  @Autowired
  public ProgressTracker(PipelineConfig pipelineConfig) {
    this(pipelineConfig.getProgress().getStreamPollInterval(), Clock.systemUTC());
  }

  public ProgressTracker(Duration pollInterval, Clock clock) {
    this.pollInterval = pollInterval;
    this.clock = clock;
  }

  /**
   * Starts tracking a job.
   *
   * @param totalUnits pages or chunks to process, 0 if not yet known
   * @throws IllegalArgumentException if the id is already tracked
   */
  public void start(String jobId, int totalUnits) {
    ProgressState state = new ProgressState(jobId, totalUnits, clock.instant());
    if (states.putIfAbsent(jobId, state) != null) {
      throw new IllegalArgumentException("Job id already in use: " + jobId);
    }
    log.debug("Tracking progress of job {} ({} units)", jobId, totalUnits);
  }

  public void setTotal(String jobId, int totalUnits) {
    state(jobId).setTotalUnits(totalUnits, clock.instant());
  }

  public void advance(String jobId, int units) {
    state(jobId).advance(units, clock.instant());
  }

  public void complete(String jobId) {
    Instant now = clock.instant();
    state(jobId).complete(now);
    lastCompletedAt.set(now);
    log.debug("Progress of job {} completed", jobId);
  }

  public void fail(String jobId, String reason) {
    state(jobId).fail(reason, clock.instant());
  }

  public boolean isTracked(String jobId) {
    return states.containsKey(jobId);
  }

  /**
   * Returns the current progress of a job.
   *
   * @throws JobNotFoundException if the job is not tracked
   */
  public ProgressSnapshot snapshot(String jobId) {
    return state(jobId).snapshot(clock.instant());
  }

  /**
   * Streams coalesced progress updates until the job reaches a terminal status.
   *
   * @throws JobNotFoundException if the job is not tracked when the stream is requested
   */
  public Flux<ProgressSnapshot> stream(String jobId) {
    ProgressState tracked = state(jobId);
    return Flux.defer(
        () -> {
          openStreams.merge(jobId, 1, Integer::sum);
          AtomicBoolean closed = new AtomicBoolean();
          Runnable close =
              () -> {
                if (closed.compareAndSet(false, true)) {
                  streamClosed(jobId, tracked);
                }
              };
          return Flux.interval(Duration.ZERO, pollInterval)
              .onBackpressureDrop()
              .takeWhile(tick -> isFollowable(jobId, tracked))
              .map(tick -> tracked.snapshot(clock.instant()))
              .distinctUntilChanged(
                  snapshot -> snapshot.status().getValue() + ":" + snapshot.roundedPercentage())
              .takeUntil(snapshot -> snapshot.status().isTerminal())
              .doOnTerminate(close)
              .doOnCancel(close);
        });
  }

  /**
   * Drops records that have not changed since the cutoff.
   *
   * @return number of records removed
   */
  public int evictIdleBefore(Instant cutoff) {
    int removed = 0;
    for (Map.Entry<String, ProgressState> entry : states.entrySet()) {
      if (entry.getValue().getLastUpdate().isBefore(cutoff)
          && states.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    return removed;
  }

  /** Returns when a job last completed, or empty if none has. */
  public Optional<Instant> lastCompletedAt() {
    return Optional.ofNullable(lastCompletedAt.get());
  }

  public int size() {
    return states.size();
  }

  /** Still tracked, or already terminal so the final update can be delivered. */
  private boolean isFollowable(String jobId, ProgressState tracked) {
    return states.get(jobId) == tracked || tracked.getStatus().isTerminal();
  }

  private void streamClosed(String jobId, ProgressState tracked) {
    Integer remaining =
        openStreams.computeIfPresent(jobId, (id, count) -> count > 1 ? count - 1 : null);
    if (remaining == null
        && tracked.getStatus() == JobStatus.COMPLETED
        && states.remove(jobId, tracked)) {
      log.debug("Purged progress of job {} after its last stream ended", jobId);
    }
  }

  private ProgressState state(String jobId) {
    ProgressState state = states.get(jobId);
    if (state == null) {
      throw new JobNotFoundException(jobId);
    }
    return state;
  }
}
