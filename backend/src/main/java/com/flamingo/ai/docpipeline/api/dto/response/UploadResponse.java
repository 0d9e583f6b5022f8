package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docpipeline.service.job.UploadResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an accepted chunked upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UploadResponse {

  private String jobId;
  private String fileName;
  private int totalPages;
  private int totalChunks;

  /** Creates an UploadResponse from an upload result. */
  public static UploadResponse from(UploadResult result) {
    return UploadResponse.builder()
        .jobId(result.jobId())
        .fileName(result.fileName())
        .totalPages(result.totalPages())
        .totalChunks(result.totalChunks())
        .build();
  }
}
