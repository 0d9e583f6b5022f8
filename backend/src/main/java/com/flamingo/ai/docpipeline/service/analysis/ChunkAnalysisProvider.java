package com.flamingo.ai.docpipeline.service.analysis;

import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.ChunkAnalysis;

/**
 * Turns one chunk file into content plus a confidence score. Exactly one implementation is active,
 * selected with {@code pipeline.analysis.provider}.
 */
public interface ChunkAnalysisProvider {

  /**
   * Analyzes a chunk.
   *
   * @param chunk the chunk and its backing file
   * @param context where the chunk sits in its job
   * @return content and a confidence on the 0-100 scale
   */
  ChunkAnalysis analyze(Chunk chunk, AnalysisContext context);

  /** Whether a result is usable: it has content and meets the confidence threshold. */
  default boolean isAcceptable(ChunkAnalysis analysis, double confidenceThreshold) {
    return !analysis.content().isBlank() && analysis.confidence() >= confidenceThreshold;
  }

  /** Provider name used in metrics and results. */
  String name();

  ProviderStats stats();

  /** Job-level information passed along with a chunk. */
  record AnalysisContext(String jobId, String fileName, int totalPages) {}

  /** Cumulative call counters of a provider. */
  record ProviderStats(long requests, long successes, long failures, long tokensUsed) {}
}
