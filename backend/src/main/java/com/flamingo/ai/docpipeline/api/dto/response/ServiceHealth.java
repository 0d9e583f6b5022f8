package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for the service health check. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceHealth {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";

  /** {@code healthy}, or {@code degraded} while any circuit breaker is not closed. */
  private String status;

  private String version;
  private long uptimeSeconds;

  /** Tasks waiting in the OCR and chunk processing queues. */
  private int queueSize;

  /** Threads currently running OCR batches. */
  private int activeWorkers;

  /** When a job last completed; absent until one has. */
  private Instant lastProcessed;

  private String ocrEngine;
  private String rasterizer;
  private String analysisProvider;

  /** Breaker name to state. */
  private Map<String, String> breakers;
}
