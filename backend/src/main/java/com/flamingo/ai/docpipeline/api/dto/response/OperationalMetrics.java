package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for the operational metrics summary. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationalMetrics {

  private long uptimeSeconds;
  private long totalRequests;
  private long errorResponses;
  private long pagesProcessed;
  private long pageFailures;

  /** Extraction outcome to count. */
  private Map<String, Long> documentsProcessed;

  /** Chunk outcome to count. */
  private Map<String, Long> chunksProcessed;

  /** Final job status to count. */
  private Map<String, Long> jobsFinalized;

  private long activeJobs;
  private int trackedProgressRecords;
  private Map<String, ExecutorStats> executors;
  private Map<String, BreakerStats> breakers;
  private AnalysisStats analysis;

  /** Worker pool counters. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ExecutorStats {
    private int poolSize;
    private int active;
    private int queued;
    private long completedTasks;
  }

  /** Circuit breaker counters. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class BreakerStats {
    private String state;
    private int failedCalls;
    private int successfulCalls;
    private long rejectedCalls;
  }

  /** Chunk analysis provider counters. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class AnalysisStats {
    private String provider;
    private long requests;
    private long successes;
    private long failures;
    private long tokensUsed;
  }
}
