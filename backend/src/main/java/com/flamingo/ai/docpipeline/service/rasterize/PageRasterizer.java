package com.flamingo.ai.docpipeline.service.rasterize;

import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;

/**
 * Converts a PDF into page images.
 *
 * <p>Implementations fail with {@link
 * com.flamingo.ai.docpipeline.exception.InvalidDocumentException} when the input is not a readable
 * PDF and with {@link com.flamingo.ai.docpipeline.exception.ConversionException} when rendering
 * fails or produces no images.
 */
public interface PageRasterizer {

  /**
   * Rasterizes every page of the document.
   *
   * @param pdfBytes the PDF
   * @param dpi rendering resolution; higher values improve OCR accuracy but cost time and memory
   * @param jobId job the work belongs to, for logging and scratch-space naming
   * @return page count, document info and the rendered pages in page order
   */
  RasterizedDocument rasterize(byte[] pdfBytes, int dpi, String jobId);

  /** Short engine name reported in metadata. */
  String engineName();
}
