package com.flamingo.ai.docpipeline.service.job;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.service.progress.ProgressTracker;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reclaims finished jobs after their retention period and progress records that nobody has
 * updated or streamed for a while.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobEvictionScheduler {

  private final JobOrchestrator jobOrchestrator;
  private final ProgressTracker progressTracker;
  private final PipelineConfig pipelineConfig;

  @Scheduled(fixedDelayString = "${pipeline.jobs.eviction-interval:PT60S}")
  public void evictExpired() {
    Instant now = Instant.now();
    int jobs =
        jobOrchestrator.evictFinishedBefore(now.minus(pipelineConfig.getJobs().getRetention()));
    int progress =
        progressTracker.evictIdleBefore(now.minus(pipelineConfig.getProgress().getRetention()));
    if (jobs > 0 || progress > 0) {
      log.info("Evicted {} finished jobs and {} idle progress records", jobs, progress);
    }
  }
}
