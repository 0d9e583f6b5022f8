package com.flamingo.ai.docpipeline.domain.model;

import java.nio.file.Path;

/**
 * A self-contained sub-document covering a page window of its source.
 *
 * @param id chunk identifier, unique within the job
 * @param file backing PDF on the work volume
 * @param range pages of the source covered by this chunk
 * @param sizeBytes size of the backing file
 */
public record Chunk(String id, Path file, PageRange range, long sizeBytes) {

  public int startPage() {
    return range.startPage();
  }

  public int endPage() {
    return range.endPage();
  }

  public int pageCount() {
    return range.pageCount();
  }
}
