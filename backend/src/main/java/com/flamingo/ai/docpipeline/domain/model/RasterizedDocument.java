package com.flamingo.ai.docpipeline.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Output of a rasterizer run.
 *
 * @param pageCount number of pages in the source document
 * @param metadata document info fields (title, author, creator, producer, ...), possibly empty
 * @param pages rendered pages in page order
 */
public record RasterizedDocument(
    int pageCount, Map<String, String> metadata, List<PageImage> pages) {

  public RasterizedDocument {
    metadata = Map.copyOf(metadata);
    pages = List.copyOf(pages);
  }
}
