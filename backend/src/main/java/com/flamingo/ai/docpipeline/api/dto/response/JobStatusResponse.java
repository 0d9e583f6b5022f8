package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import com.flamingo.ai.docpipeline.domain.model.JobSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the status of a chunked job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

  private String jobId;
  private JobStatus status;
  private Progress progress;
  private String error;

  /** Chunk counters. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class Progress {
    private int completedChunks;
    private int totalChunks;
    private double percentage;
  }

  /** Creates a JobStatusResponse from a job snapshot. */
  public static JobStatusResponse from(JobSnapshot snapshot) {
    return JobStatusResponse.builder()
        .jobId(snapshot.jobId())
        .status(snapshot.status())
        .progress(
            Progress.builder()
                .completedChunks(snapshot.completedChunks())
                .totalChunks(snapshot.totalChunks())
                .percentage(Math.round(snapshot.percentage() * 100.0) / 100.0)
                .build())
        .error(snapshot.errorMessage())
        .build();
  }
}
