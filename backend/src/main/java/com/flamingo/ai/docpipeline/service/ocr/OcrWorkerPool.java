package com.flamingo.ai.docpipeline.service.ocr;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.OcrDocumentResult;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.PageResult;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs OCR over the pages of a document on the bounded {@code ocrExecutor}.
 *
 * <p>Pages are grouped into batches the size of the worker limit and every batch is dispatched at
 * once; the executor bounds the actual concurrency. The progress listener hears about each batch
 * as it completes, which may be out of order. A page that fails yields an empty result with zero
 * confidence and never aborts its siblings. A page refused by an open breaker is different: the
 * remaining pages still run, but the document as a whole then fails.
 */
@Service
@Slf4j
public class OcrWorkerPool {

  private final OcrEngine ocrEngine;
  private final Executor ocrExecutor;
  private final MeterRegistry meterRegistry;
  private final int batchSize;
  private final int maxWorkers;

  public OcrWorkerPool(
      OcrEngine ocrEngine,
      @Qualifier("ocrExecutor") Executor ocrExecutor,
      MeterRegistry meterRegistry,
      PipelineConfig pipelineConfig) {
    this.ocrEngine = ocrEngine;
    this.ocrExecutor = ocrExecutor;
    this.meterRegistry = meterRegistry;
    this.batchSize = Math.max(1, pipelineConfig.getOcr().effectiveBatchSize());
    this.maxWorkers = pipelineConfig.getOcr().getMaxWorkers();
  }

  /**
   * OCRs every page.
   *
   * @param pages page images, in any order
   * @param jobId owning job, for logging
   * @param onProgress told the size of each batch as it finishes
   * @return one result per page, sorted by page number
   * @throws DownstreamUnavailableException if any page was refused by the OCR breaker
   * @throws RejectedExecutionException if the executor refuses a page; pages already queued are
   *     cancelled and report no progress
   */
  public OcrDocumentResult processDocument(
      List<PageImage> pages, String jobId, PageProgressListener onProgress) {
    Objects.requireNonNull(onProgress, "onProgress");
    if (pages.isEmpty()) {
      return new OcrDocumentResult(List.of());
    }

    log.info(
        "OCR of {} pages for job {} in batches of {} ({} workers)",
        pages.size(),
        jobId,
        batchSize,
        maxWorkers);

    Map<Integer, DownstreamUnavailableException> refused = new ConcurrentSkipListMap<>();
    List<CompletableFuture<PageResult>> dispatched = new ArrayList<>(pages.size());
    List<CompletableFuture<List<PageResult>>> batches = new ArrayList<>();
    try {
      for (int from = 0; from < pages.size(); from += batchSize) {
        List<PageImage> batch = pages.subList(from, Math.min(from + batchSize, pages.size()));
        batches.add(dispatchBatch(batch, jobId, onProgress, refused, dispatched));
      }
    } catch (RejectedExecutionException e) {
      log.warn(
          "Job {}: OCR executor refused a page, cancelling {} queued pages",
          jobId,
          dispatched.size());
      dispatched.forEach(future -> future.cancel(false));
      throw e;
    }

    List<PageResult> results = new ArrayList<>(pages.size());
    for (CompletableFuture<List<PageResult>> batch : batches) {
      results.addAll(batch.join());
    }
    results.sort(Comparator.comparingInt(PageResult::pageNumber));

    if (!refused.isEmpty()) {
      DownstreamUnavailableException first = refused.values().iterator().next();
      log.warn("Job {}: OCR unavailable for pages {}", jobId, refused.keySet());
      throw new DownstreamUnavailableException(
          first.getDependency(),
          "OCR unavailable for pages " + refused.keySet() + ": " + first.getMessage(),
          first);
    }

    OcrDocumentResult document = new OcrDocumentResult(results);
    if (!document.failedPages().isEmpty()) {
      log.warn("Job {}: OCR failed on pages {}", jobId, document.failedPages());
    }
    return document;
  }

  private CompletableFuture<List<PageResult>> dispatchBatch(
      List<PageImage> batch,
      String jobId,
      PageProgressListener onProgress,
      Map<Integer, DownstreamUnavailableException> refused,
      List<CompletableFuture<PageResult>> dispatched) {
    List<CompletableFuture<PageResult>> futures = new ArrayList<>(batch.size());
    for (PageImage page : batch) {
      CompletableFuture<PageResult> future =
          CompletableFuture.supplyAsync(() -> recognize(page, jobId, refused), ocrExecutor);
      futures.add(future);
      dispatched.add(future);
    }
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .thenApply(
            done -> {
              List<PageResult> results = futures.stream().map(CompletableFuture::join).toList();
              notifyProgress(onProgress, results.size(), jobId);
              return results;
            });
  }

  private PageResult recognize(
      PageImage page, String jobId, Map<Integer, DownstreamUnavailableException> refused) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      PageResult result = ocrEngine.recognize(page, jobId);
      meterRegistry.counter("pipeline_pages_processed_total").increment();
      return result;
    } catch (DownstreamUnavailableException e) {
      log.warn("OCR refused page {} of job {}: {}", page.pageNumber(), jobId, e.getMessage());
      meterRegistry.counter("pipeline_page_failures_total").increment();
      refused.put(page.pageNumber(), e);
      return PageResult.failed(page.pageNumber(), e.getMessage());
    } catch (RuntimeException e) {
      log.warn("OCR failed on page {} of job {}: {}", page.pageNumber(), jobId, e.getMessage());
      meterRegistry.counter("pipeline_page_failures_total").increment();
      return PageResult.failed(page.pageNumber(), e.getMessage());
    } finally {
      sample.stop(
          meterRegistry.timer("pipeline_ocr_page_duration", "engine", ocrEngine.engineName()));
    }
  }

  private void notifyProgress(PageProgressListener onProgress, int count, String jobId) {
    try {
      onProgress.onPagesProcessed(count);
    } catch (RuntimeException e) {
      log.warn("Progress listener for job {} failed: {}", jobId, e.getMessage());
    }
  }

  public String engineName() {
    return ocrEngine.engineName();
  }

  public int getBatchSize() {
    return batchSize;
  }

  public int getMaxWorkers() {
    return maxWorkers;
  }
}
