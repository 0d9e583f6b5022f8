package com.flamingo.ai.docpipeline.domain.model;

/**
 * One rasterized page, PNG encoded.
 *
 * @param pageNumber 1-based page number within the rasterized document
 * @param dpi resolution the page was rendered at
 * @param png encoded image bytes
 */
public record PageImage(int pageNumber, int dpi, byte[] png) {}
