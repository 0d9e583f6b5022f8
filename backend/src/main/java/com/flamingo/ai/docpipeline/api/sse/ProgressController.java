package com.flamingo.ai.docpipeline.api.sse;

import com.flamingo.ai.docpipeline.api.dto.response.ProgressResponse;
import com.flamingo.ai.docpipeline.service.progress.ProgressTracker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for job progress, polled or streamed with Server-Sent Events. */
@RestController
@RequestMapping("/api")
@Slf4j
public class ProgressController {

  static final String PROGRESS_EVENT = "progress";

  private final ProgressTracker progressTracker;
  private final AtomicInteger activeConnections;

  public ProgressController(ProgressTracker progressTracker, MeterRegistry meterRegistry) {
    this.progressTracker = progressTracker;
    this.activeConnections =
        meterRegistry.gauge("sse.connections.active", new AtomicInteger(0));
  }

  /** Gets the current progress of a job. */
  @GetMapping("/progress/{jobId}")
  public ResponseEntity<ProgressResponse> getProgress(@PathVariable String jobId) {
    return ResponseEntity.ok(ProgressResponse.from(progressTracker.snapshot(jobId)));
  }

  /**
   * Streams progress updates of a job. An event is sent whenever the rounded percentage or the
   * status changes; the stream ends after the terminal update.
   */
  @GetMapping(value = "/progress-stream/{jobId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<ProgressResponse>> streamProgress(@PathVariable String jobId) {
    Flux<ServerSentEvent<ProgressResponse>> events =
        progressTracker
            .stream(jobId)
            .map(
                snapshot ->
                    ServerSentEvent.builder(ProgressResponse.from(snapshot))
                        .event(PROGRESS_EVENT)
                        .build());

    activeConnections.incrementAndGet();
    log.debug("Progress stream opened for job {}", jobId);
    return events
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Progress stream completed for job {}", jobId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Progress stream error for job {}: {}", jobId, e.getMessage());
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Progress stream cancelled for job {}", jobId);
            });
  }
}
