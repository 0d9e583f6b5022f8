package com.flamingo.ai.docpipeline.domain.model;

/**
 * Recorded outcome of one chunk of a job.
 *
 * @param chunkId chunk identifier
 * @param startPage first source page of the chunk
 * @param endPage last source page of the chunk
 * @param content analysis content, empty on failure
 * @param confidence 0-100, 0 on failure
 * @param model producing model or engine, null on failure
 * @param error failure reason, or null on success
 */
public record ChunkResult(
    String chunkId,
    int startPage,
    int endPage,
    String content,
    double confidence,
    String model,
    String error) {

  public static ChunkResult success(Chunk chunk, ChunkAnalysis analysis) {
    return new ChunkResult(
        chunk.id(),
        chunk.startPage(),
        chunk.endPage(),
        analysis.content(),
        analysis.confidence(),
        analysis.model(),
        null);
  }

  public static ChunkResult failed(Chunk chunk, String error) {
    return new ChunkResult(
        chunk.id(),
        chunk.startPage(),
        chunk.endPage(),
        "",
        0.0,
        null,
        error == null ? "Chunk processing failed" : error);
  }

  public boolean failed() {
    return error != null;
  }
}
