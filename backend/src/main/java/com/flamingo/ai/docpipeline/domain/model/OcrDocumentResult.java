package com.flamingo.ai.docpipeline.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Page-ordered OCR results for one document.
 *
 * @param pages results sorted by ascending page number
 */
public record OcrDocumentResult(List<PageResult> pages) {

  public OcrDocumentResult {
    pages = List.copyOf(pages);
  }

  /** Page texts joined by newlines, in page order. */
  public String text() {
    return pages.stream().map(PageResult::text).collect(Collectors.joining("\n"));
  }

  /** Mean page confidence; failed pages count as 0. Zero for an empty document. */
  public double confidence() {
    return pages.stream().mapToDouble(PageResult::confidence).average().orElse(0.0);
  }

  public List<Integer> failedPages() {
    return pages.stream().filter(PageResult::failed).map(PageResult::pageNumber).toList();
  }
}
