package com.flamingo.ai.docpipeline.service.extraction;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.OcrDocumentResult;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.exception.JobNotFoundException;
import com.flamingo.ai.docpipeline.service.document.PdfUploadValidator;
import com.flamingo.ai.docpipeline.service.ocr.OcrWorkerPool;
import com.flamingo.ai.docpipeline.service.progress.ProgressTracker;
import com.flamingo.ai.docpipeline.service.rasterize.PageRasterizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the ExtractionService. */
@Service
@Slf4j
public class ExtractionServiceImpl implements ExtractionService {

  private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

  private final PdfUploadValidator uploadValidator;
  private final PageRasterizer pageRasterizer;
  private final OcrWorkerPool ocrWorkerPool;
  private final ProgressTracker progressTracker;
  private final Executor extractionExecutor;
  private final MeterRegistry meterRegistry;
  private final PipelineConfig pipelineConfig;

  public ExtractionServiceImpl(
      PdfUploadValidator uploadValidator,
      PageRasterizer pageRasterizer,
      OcrWorkerPool ocrWorkerPool,
      ProgressTracker progressTracker,
      @Qualifier("extractionExecutor") Executor extractionExecutor,
      MeterRegistry meterRegistry,
      PipelineConfig pipelineConfig) {
    this.uploadValidator = uploadValidator;
    this.pageRasterizer = pageRasterizer;
    this.ocrWorkerPool = ocrWorkerPool;
    this.progressTracker = progressTracker;
    this.extractionExecutor = extractionExecutor;
    this.meterRegistry = meterRegistry;
    this.pipelineConfig = pipelineConfig;
  }

  @Override
  public ExtractionTicket submit(MultipartFile file, Integer dpi, String jobId) {
    int effectiveDpi = resolveDpi(dpi);
    String effectiveJobId = resolveJobId(jobId);
    byte[] pdfBytes = uploadValidator.validateAndRead(file);
    String fileName = file.getOriginalFilename();
    String contentType = file.getContentType();

    log.info(
        "Extraction job {} accepted for '{}' ({} bytes, {} DPI)",
        effectiveJobId,
        fileName,
        pdfBytes.length,
        effectiveDpi);
    progressTracker.start(effectiveJobId, 0);

    try {
      CompletableFuture<ExtractionResult> result =
          CompletableFuture.supplyAsync(
              () -> extract(effectiveJobId, fileName, contentType, pdfBytes, effectiveDpi),
              extractionExecutor);
      return new ExtractionTicket(effectiveJobId, result);
    } catch (RejectedExecutionException e) {
      progressTracker.fail(effectiveJobId, "Server is busy");
      throw e;
    }
  }

  ExtractionResult extract(
      String jobId, String fileName, String contentType, byte[] pdfBytes, int dpi) {
    long startTime = System.currentTimeMillis();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      RasterizedDocument document = pageRasterizer.rasterize(pdfBytes, dpi, jobId);
      progressTracker.setTotal(jobId, document.pages().size());

      OcrDocumentResult ocr =
          ocrWorkerPool.processDocument(
              document.pages(), jobId, count -> progressTracker.advance(jobId, count));
      progressTracker.complete(jobId);

      double seconds = (System.currentTimeMillis() - startTime) / 1000.0;
      meterRegistry.counter("pipeline_documents_processed_total", "outcome", "success").increment();
      log.info(
          "Extraction job {} done: {} pages in {}s, confidence {}",
          jobId,
          document.pageCount(),
          String.format("%.2f", seconds),
          String.format("%.1f", ocr.confidence()));

      return new ExtractionResult(
          jobId,
          fileName,
          contentType,
          ocr.text(),
          ocr.confidence(),
          document.pageCount(),
          dpi,
          ocrWorkerPool.getMaxWorkers(),
          pageRasterizer.engineName(),
          seconds,
          ocr.failedPages(),
          document.metadata());
    } catch (RuntimeException e) {
      meterRegistry.counter("pipeline_documents_processed_total", "outcome", "failure").increment();
      log.error("Extraction job {} failed: {}", jobId, e.getMessage());
      markFailed(jobId, e);
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("pipeline_extraction_duration"));
    }
  }

  private void markFailed(String jobId, RuntimeException cause) {
    try {
      progressTracker.fail(jobId, cause.getMessage());
    } catch (JobNotFoundException e) {
      log.debug("Progress record of job {} already reclaimed", jobId);
    }
  }

  private int resolveDpi(Integer dpi) {
    if (dpi == null) {
      return pipelineConfig.getOcr().getDefaultDpi();
    }
    int maxDpi = pipelineConfig.getRasterizer().getMaxDpi();
    if (dpi < 1 || dpi > maxDpi) {
      throw new IllegalArgumentException("dpi must be between 1 and " + maxDpi);
    }
    return dpi;
  }

  private String resolveJobId(String jobId) {
    if (jobId == null || jobId.isBlank()) {
      return UUID.randomUUID().toString();
    }
    if (!JOB_ID_PATTERN.matcher(jobId).matches()) {
      throw new IllegalArgumentException("job_id must be 1-64 letters, digits, '-' or '_'");
    }
    return jobId;
  }
}
