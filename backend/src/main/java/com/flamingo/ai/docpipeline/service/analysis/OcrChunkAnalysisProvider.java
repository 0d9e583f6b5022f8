package com.flamingo.ai.docpipeline.service.analysis;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.ChunkAnalysis;
import com.flamingo.ai.docpipeline.domain.model.OcrDocumentResult;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.service.ocr.OcrWorkerPool;
import com.flamingo.ai.docpipeline.service.ocr.PageProgressListener;
import com.flamingo.ai.docpipeline.service.rasterize.PageRasterizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Analyzes chunks locally: rasterize, then OCR every page. The default provider. */
@Service
@ConditionalOnProperty(
    name = "pipeline.analysis.provider",
    havingValue = "ocr",
    matchIfMissing = true)
@Slf4j
public class OcrChunkAnalysisProvider implements ChunkAnalysisProvider {

  static final String NAME = "ocr";

  private final PageRasterizer pageRasterizer;
  private final OcrWorkerPool ocrWorkerPool;
  private final int dpi;
  private final ProviderCounters counters;

  public OcrChunkAnalysisProvider(
      PageRasterizer pageRasterizer,
      OcrWorkerPool ocrWorkerPool,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    this.pageRasterizer = pageRasterizer;
    this.ocrWorkerPool = ocrWorkerPool;
    this.dpi = pipelineConfig.getOcr().getDefaultDpi();
    this.counters = new ProviderCounters(NAME, meterRegistry);
  }

  @Override
  public ChunkAnalysis analyze(Chunk chunk, AnalysisContext context) {
    counters.request();
    try {
      byte[] bytes = Files.readAllBytes(chunk.file());
      String workId = context.jobId() + "-" + chunk.id();
      RasterizedDocument document = pageRasterizer.rasterize(bytes, dpi, workId);
      OcrDocumentResult ocr =
          ocrWorkerPool.processDocument(document.pages(), workId, PageProgressListener.NONE);

      log.debug(
          "Chunk {} of job {}: {} pages OCR'd, confidence {}",
          chunk.id(),
          context.jobId(),
          ocr.pages().size(),
          String.format("%.1f", ocr.confidence()));
      counters.success(0);
      return new ChunkAnalysis(ocr.text(), ocr.confidence(), ocrWorkerPool.engineName(), 0);
    } catch (IOException e) {
      counters.failure();
      throw new UncheckedIOException("Cannot read chunk file " + chunk.file(), e);
    } catch (RuntimeException e) {
      counters.failure();
      throw e;
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ProviderStats stats() {
    return counters.snapshot();
  }
}
