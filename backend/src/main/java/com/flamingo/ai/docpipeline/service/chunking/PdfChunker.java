package com.flamingo.ai.docpipeline.service.chunking;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.PageRange;
import com.flamingo.ai.docpipeline.exception.ChunkTooLargeException;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import com.flamingo.ai.docpipeline.service.rasterize.PdfPageRenderer;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Splits a PDF into overlapping, self-contained chunk files.
 *
 * <p>Each chunk is serialized in memory first, checked against the maximum chunk size and the free
 * space on the work volume, and only then written. If any chunk fails, the chunks already written
 * are deleted before the exception propagates.
 */
@Service
@Slf4j
public class PdfChunker {

  private final WorkspaceStorage workspaceStorage;
  private final PipelineConfig.Chunking settings;

  public PdfChunker(WorkspaceStorage workspaceStorage, PipelineConfig pipelineConfig) {
    this.workspaceStorage = workspaceStorage;
    this.settings = pipelineConfig.getChunking();
  }

  /**
   * Plans the page windows for a document. A document that fits in one chunk yields one window;
   * otherwise each window starts {@code max(1, chunkSize - overlap)} pages after the previous one,
   * so the plan always advances even when the overlap is as large as the chunk.
   */
  public static List<PageRange> planWindows(int totalPages, int chunkSize, int overlap) {
    if (totalPages < 1) {
      throw new IllegalArgumentException("totalPages must be positive: " + totalPages);
    }
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (overlap < 0) {
      throw new IllegalArgumentException("overlap must not be negative: " + overlap);
    }
    if (totalPages <= chunkSize) {
      return List.of(new PageRange(1, totalPages));
    }

    int step = Math.max(1, chunkSize - overlap);
    List<PageRange> windows = new ArrayList<>();
    for (int start = 1; start <= totalPages; start += step) {
      int end = Math.min(start + chunkSize - 1, totalPages);
      windows.add(new PageRange(start, end));
      if (end == totalPages) {
        break;
      }
    }
    return windows;
  }

  /** Splits with the configured chunk size and overlap. */
  public SplitDocument split(byte[] pdfBytes, String jobId, Path outputDir) {
    return split(pdfBytes, jobId, outputDir, settings.getChunkSize(), settings.getOverlap());
  }

  /**
   * Splits the document and writes one PDF per window into {@code outputDir}.
   *
   * @throws InvalidDocumentException if the input cannot be parsed or has no pages
   * @throws ChunkTooLargeException if a chunk exceeds the maximum chunk size
   * @throws com.flamingo.ai.docpipeline.exception.InsufficientStorageException if the work volume
   *     cannot hold the next chunk
   */
  public SplitDocument split(
      byte[] pdfBytes, String jobId, Path outputDir, int chunkSize, int overlap) {
    List<Chunk> written = new ArrayList<>();
    try (PDDocument document = PdfPageRenderer.load(pdfBytes, jobId)) {
      int totalPages = document.getNumberOfPages();
      if (totalPages == 0) {
        throw new InvalidDocumentException(jobId, "Document contains no pages");
      }

      List<PageRange> windows = planWindows(totalPages, chunkSize, overlap);
      log.info(
          "Splitting job {} ({} pages) into {} chunks of {} pages with overlap {}",
          jobId,
          totalPages,
          windows.size(),
          chunkSize,
          overlap);

      for (int index = 0; index < windows.size(); index++) {
        written.add(writeChunk(document, windows.get(index), index + 1, outputDir, jobId));
      }
      return new SplitDocument(totalPages, written);
    } catch (IOException e) {
      written.forEach(chunk -> workspaceStorage.delete(chunk.file()));
      throw new ConversionException("pdfbox", "Failed to split document for job " + jobId, e);
    } catch (RuntimeException e) {
      written.forEach(chunk -> workspaceStorage.delete(chunk.file()));
      throw e;
    }
  }

  private Chunk writeChunk(
      PDDocument document, PageRange range, int sequence, Path outputDir, String jobId)
      throws IOException {
    byte[] bytes = extract(document, range);

    if (bytes.length > settings.getMaxChunkBytes()) {
      throw new ChunkTooLargeException(
          range.startPage(), range.endPage(), bytes.length, settings.getMaxChunkBytes());
    }
    workspaceStorage.ensureSpace(outputDir, bytes.length, settings.getStorageReserveBytes());

    String chunkId = String.format("chunk-%03d", sequence);
    Path file =
        outputDir.resolve(
            String.format("%s_p%d-%d.pdf", chunkId, range.startPage(), range.endPage()));
    try {
      Files.write(file, bytes);
    } catch (IOException e) {
      workspaceStorage.delete(file);
      throw new UncheckedIOException("Failed to write " + file, e);
    }
    log.debug(
        "Job {}: wrote {} pages {}-{} ({} bytes)",
        jobId,
        chunkId,
        range.startPage(),
        range.endPage(),
        bytes.length);
    return new Chunk(chunkId, file, range, bytes.length);
  }

  private static byte[] extract(PDDocument document, PageRange range) throws IOException {
    Splitter splitter = new Splitter();
    splitter.setStartPage(range.startPage());
    splitter.setEndPage(range.endPage());
    splitter.setSplitAtPage(range.pageCount());
    List<PDDocument> parts = splitter.split(document);
    try {
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      parts.get(0).save(baos);
      return baos.toByteArray();
    } finally {
      for (PDDocument part : parts) {
        part.close();
      }
    }
  }
}
