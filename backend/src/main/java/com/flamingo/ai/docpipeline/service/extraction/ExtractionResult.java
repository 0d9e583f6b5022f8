package com.flamingo.ai.docpipeline.service.extraction;

import java.util.List;
import java.util.Map;

/** Outcome of a whole-document extraction. */
public record ExtractionResult(
    String jobId,
    String fileName,
    String contentType,
    String text,
    double confidence,
    int pageCount,
    int dpi,
    int workers,
    String rasterizer,
    double processingTimeSeconds,
    List<Integer> failedPages,
    Map<String, String> documentInfo) {

  public ExtractionResult {
    failedPages = List.copyOf(failedPages);
    documentInfo = Map.copyOf(documentInfo);
  }
}
