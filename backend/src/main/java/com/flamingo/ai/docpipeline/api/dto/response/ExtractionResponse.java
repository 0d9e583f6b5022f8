package com.flamingo.ai.docpipeline.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.docpipeline.service.extraction.ExtractionResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a whole-document extraction. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionResponse {

  private String text;

  /** Mean page confidence, 0-100. Failed pages count as 0. */
  private double confidence;

  private Metadata metadata;

  /** Extraction metadata. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class Metadata {
    private int numPages;
    private String filename;
    private String contentType;
    private boolean parallelProcessed;
    private double processingTimeSeconds;
    private String jobId;
    private int dpi;
    private int workers;
    private String rasterizer;
    private List<Integer> failedPages;
    private String title;
    private String author;
    private String creator;
    private String producer;
  }

  /** Creates an ExtractionResponse from an extraction result. */
  public static ExtractionResponse from(ExtractionResult result) {
    return ExtractionResponse.builder()
        .text(result.text())
        .confidence(round(result.confidence()))
        .metadata(
            Metadata.builder()
                .numPages(result.pageCount())
                .filename(result.fileName())
                .contentType(result.contentType())
                .parallelProcessed(result.workers() > 1 && result.pageCount() > 1)
                .processingTimeSeconds(round(result.processingTimeSeconds()))
                .jobId(result.jobId())
                .dpi(result.dpi())
                .workers(result.workers())
                .rasterizer(result.rasterizer())
                .failedPages(result.failedPages())
                .title(result.documentInfo().get("title"))
                .author(result.documentInfo().get("author"))
                .creator(result.documentInfo().get("creator"))
                .producer(result.documentInfo().get("producer"))
                .build())
        .build();
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
