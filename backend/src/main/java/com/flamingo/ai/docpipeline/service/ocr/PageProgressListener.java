package com.flamingo.ai.docpipeline.service.ocr;

/** Receives the number of pages finished each time an OCR batch completes. */
@FunctionalInterface
public interface PageProgressListener {

  /** Listener for callers that do not track progress. */
  PageProgressListener NONE = count -> {};

  void onPagesProcessed(int count);
}
