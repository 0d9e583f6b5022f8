package com.flamingo.ai.docpipeline.service.chunking;

import com.flamingo.ai.docpipeline.domain.model.Chunk;
import java.util.List;

/**
 * Chunks written for one source document.
 *
 * @param totalPages pages in the source
 * @param chunks chunks in start-page order
 */
public record SplitDocument(int totalPages, List<Chunk> chunks) {

  public SplitDocument {
    chunks = List.copyOf(chunks);
  }
}
