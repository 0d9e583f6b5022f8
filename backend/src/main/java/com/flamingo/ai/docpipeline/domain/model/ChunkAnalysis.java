package com.flamingo.ai.docpipeline.domain.model;

/**
 * What an analysis provider returns for one chunk.
 *
 * @param content extracted or generated text
 * @param confidence quality estimate on the 0-100 scale
 * @param model model or engine that produced the content
 * @param tokensUsed tokens consumed, 0 for local engines
 */
public record ChunkAnalysis(String content, double confidence, String model, long tokensUsed) {

  public ChunkAnalysis {
    content = content == null ? "" : content;
    confidence = PageResult.clampConfidence(confidence);
  }
}
