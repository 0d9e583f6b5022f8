package com.flamingo.ai.docpipeline.domain.model;

/** Inclusive, 1-based page window. */
public record PageRange(int startPage, int endPage) {

  public PageRange {
    if (startPage < 1 || endPage < startPage) {
      throw new IllegalArgumentException("Invalid page range " + startPage + "-" + endPage);
    }
  }

  public int pageCount() {
    return endPage - startPage + 1;
  }
}
