package com.flamingo.ai.docpipeline.domain.model;

/**
 * OCR outcome for a single page. Confidence is on the 0-100 scale and always clamped to it.
 *
 * @param pageNumber 1-based page number
 * @param text extracted text, empty when the page failed
 * @param confidence mean word confidence, 0 when the page failed
 * @param error failure reason, or null on success
 */
public record PageResult(int pageNumber, String text, double confidence, String error) {

  public static final double MIN_CONFIDENCE = 0.0;
  public static final double MAX_CONFIDENCE = 100.0;

  public PageResult {
    text = text == null ? "" : text;
    confidence = clampConfidence(confidence);
  }

  public static PageResult success(int pageNumber, String text, double confidence) {
    return new PageResult(pageNumber, text, confidence, null);
  }

  public static PageResult failed(int pageNumber, String error) {
    return new PageResult(pageNumber, "", MIN_CONFIDENCE, error == null ? "OCR failed" : error);
  }

  public boolean failed() {
    return error != null;
  }

  static double clampConfidence(double value) {
    if (Double.isNaN(value)) {
      return MIN_CONFIDENCE;
    }
    return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, value));
  }
}
