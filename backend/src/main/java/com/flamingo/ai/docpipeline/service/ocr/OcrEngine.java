package com.flamingo.ai.docpipeline.service.ocr;

import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.PageResult;

/** Extracts text from a single page image. */
public interface OcrEngine {

  /**
   * Runs OCR on one page.
   *
   * @return the page text and its confidence on the 0-100 scale
   * @throws RuntimeException on any engine failure; callers isolate it to the page
   */
  PageResult recognize(PageImage page, String jobId);

  String engineName();
}
