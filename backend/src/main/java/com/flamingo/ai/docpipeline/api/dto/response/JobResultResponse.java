package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import com.flamingo.ai.docpipeline.domain.model.ChunkResult;
import com.flamingo.ai.docpipeline.domain.model.JobSnapshot;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the merged results of a chunked job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResultResponse {

  private String jobId;
  private JobStatus status;
  private String fileName;
  private int totalPages;
  private int totalChunks;
  private int completedChunks;

  /** Per-chunk results in start-page order. */
  private List<ChunkResultResponse> results;

  /** Content of the successful chunks, in start-page order. */
  private String mergedText;

  /** Mean confidence of the successful chunks, 0-100. */
  private double confidence;

  private String error;

  /** One chunk's result. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ChunkResultResponse {
    private String chunkId;
    private int startPage;
    private int endPage;
    private String content;
    private double confidence;
    private String model;
    private String error;

    static ChunkResultResponse from(ChunkResult result) {
      return ChunkResultResponse.builder()
          .chunkId(result.chunkId())
          .startPage(result.startPage())
          .endPage(result.endPage())
          .content(result.content())
          .confidence(result.confidence())
          .model(result.model())
          .error(result.error())
          .build();
    }
  }

  /** Creates a JobResultResponse from a job snapshot. */
  public static JobResultResponse from(JobSnapshot snapshot) {
    return JobResultResponse.builder()
        .jobId(snapshot.jobId())
        .status(snapshot.status())
        .fileName(snapshot.fileName())
        .totalPages(snapshot.totalPages())
        .totalChunks(snapshot.totalChunks())
        .completedChunks(snapshot.completedChunks())
        .results(snapshot.results().stream().map(ChunkResultResponse::from).toList())
        .mergedText(
            snapshot.results().stream()
                .filter(result -> !result.failed())
                .map(ChunkResult::content)
                .collect(Collectors.joining("\n\n")))
        .confidence(Math.round(snapshot.confidence() * 100.0) / 100.0)
        .error(snapshot.errorMessage())
        .build();
  }
}
