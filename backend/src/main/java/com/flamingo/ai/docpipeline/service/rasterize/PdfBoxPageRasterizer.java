package com.flamingo.ai.docpipeline.service.rasterize;

import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Renders pages in-process with PDFBox. The page count always comes from the document's page tree,
 * so no probing is needed.
 */
@Service
@ConditionalOnProperty(
    name = "pipeline.rasterizer.engine",
    havingValue = "pdfbox",
    matchIfMissing = true)
@Slf4j
public class PdfBoxPageRasterizer implements PageRasterizer {

  static final String ENGINE = "pdfbox";

  @Override
  public RasterizedDocument rasterize(byte[] pdfBytes, int dpi, String jobId) {
    long startTime = System.currentTimeMillis();
    try (PDDocument document = PdfPageRenderer.load(pdfBytes, jobId)) {
      int pageCount = document.getNumberOfPages();
      if (pageCount == 0) {
        throw new InvalidDocumentException(jobId, "Document contains no pages");
      }
      Map<String, String> metadata = PdfMetadata.from(document, pdfBytes.length);

      List<PageImage> pages;
      try {
        pages = PdfPageRenderer.render(document, 0, pageCount, dpi);
      } catch (IOException | RuntimeException e) {
        throw new ConversionException(ENGINE, "Failed to render pages of job " + jobId, e);
      }
      if (pages.isEmpty()) {
        throw new ConversionException(ENGINE, "Rendering produced no images for job " + jobId);
      }

      log.info(
          "Rasterized {} pages at {} DPI for job {} in {}ms",
          pages.size(),
          dpi,
          jobId,
          System.currentTimeMillis() - startTime);
      return new RasterizedDocument(pageCount, metadata, pages);
    } catch (IOException e) {
      // close() failure after a successful render
      throw new ConversionException(ENGINE, "Failed to release document for job " + jobId, e);
    }
  }

  @Override
  public String engineName() {
    return ENGINE;
  }
}
