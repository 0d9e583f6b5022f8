package com.flamingo.ai.docpipeline.service.extraction;

import org.springframework.web.multipart.MultipartFile;

/** Service for whole-document OCR extraction. */
public interface ExtractionService {

  /**
   * Validates an upload, registers its progress record and starts extraction in the background.
   *
   * @param file the uploaded PDF
   * @param dpi rasterization resolution, or null for the configured default
   * @param jobId caller-chosen job id so progress can be followed before the upload finishes, or
   *     null to generate one
   * @return the job id and the pending result
   */
  ExtractionTicket submit(MultipartFile file, Integer dpi, String jobId);
}
