package com.flamingo.ai.docpipeline.exception;

/** Exception thrown when a generated chunk exceeds the maximum chunk size. */
public class ChunkTooLargeException extends ResourceExhaustedException {

  private final int startPage;
  private final int endPage;

  public ChunkTooLargeException(int startPage, int endPage, long sizeBytes, long maxBytes) {
    super(
        "Chunk of pages " + startPage + "-" + endPage + " is " + sizeBytes + " bytes, limit "
            + maxBytes,
        sizeBytes,
        maxBytes);
    this.startPage = startPage;
    this.endPage = endPage;
  }

  public int getStartPage() {
    return startPage;
  }

  public int getEndPage() {
    return endPage;
  }

  @Override
  public String getUserMessage() {
    return "Pages " + startPage + "-" + endPage + " exceed the maximum chunk size";
  }
}
