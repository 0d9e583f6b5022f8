package com.flamingo.ai.docpipeline.service.analysis;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.ChunkAnalysis;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisProvider.AnalysisContext;
import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Calls the active analysis provider through the {@code analysis} circuit breaker and rejects
 * results that are empty or below the confidence threshold.
 */
@Service
@Slf4j
public class ChunkAnalysisService {

  private final ChunkAnalysisProvider provider;
  private final DownstreamGuard guard;
  private final double confidenceThreshold;

  public ChunkAnalysisService(
      ChunkAnalysisProvider provider,
      @Qualifier(DownstreamGuard.ANALYSIS) DownstreamGuard guard,
      PipelineConfig pipelineConfig) {
    this.provider = provider;
    this.guard = guard;
    this.confidenceThreshold = pipelineConfig.getAnalysis().getConfidenceThreshold();
  }

  /**
   * Analyzes one chunk.
   *
   * @throws com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException if the breaker
   *     is open or the provider is unreachable
   * @throws ConversionException if the provider result is not acceptable
   */
  public ChunkAnalysis analyze(Chunk chunk, AnalysisContext context) {
    ChunkAnalysis analysis = guard.call(() -> provider.analyze(chunk, context));
    if (!provider.isAcceptable(analysis, confidenceThreshold)) {
      log.warn(
          "Rejected {} result for chunk {} of job {}: {} chars, confidence {} (threshold {})",
          provider.name(),
          chunk.id(),
          context.jobId(),
          analysis.content().length(),
          analysis.confidence(),
          confidenceThreshold);
      throw new ConversionException(
          provider.name(),
          String.format(
              Locale.ROOT,
              "Result rejected: confidence %.1f below %.1f or empty content",
              analysis.confidence(), confidenceThreshold));
    }
    return analysis;
  }

  public ChunkAnalysisProvider getProvider() {
    return provider;
  }
}
