package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import com.flamingo.ai.docpipeline.domain.model.ProgressSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for job progress, used by both polling and streaming. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressResponse {

  private String jobId;

  /** Units of work: pages for extractions, chunks for chunked jobs. */
  private int totalPages;

  private int processedPages;
  private JobStatus status;
  private double progressPercentage;

  /** Seconds; absent until the first unit has been processed. */
  private Double estimatedTimeRemaining;

  private String error;

  /** Creates a ProgressResponse from a progress snapshot. */
  public static ProgressResponse from(ProgressSnapshot snapshot) {
    return ProgressResponse.builder()
        .jobId(snapshot.jobId())
        .totalPages(snapshot.totalUnits())
        .processedPages(snapshot.processedUnits())
        .status(snapshot.status())
        .progressPercentage(Math.round(snapshot.percentage() * 100.0) / 100.0)
        .estimatedTimeRemaining(
            snapshot.estimatedSecondsRemaining() == null
                ? null
                : Math.round(snapshot.estimatedSecondsRemaining() * 10.0) / 10.0)
        .error(snapshot.errorMessage())
        .build();
  }
}
