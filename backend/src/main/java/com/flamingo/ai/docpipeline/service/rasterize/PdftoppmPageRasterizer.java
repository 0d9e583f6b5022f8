package com.flamingo.ai.docpipeline.service.rasterize;

import com.flamingo.ai.docpipeline.common.process.ProcessExecutor;
import com.flamingo.ai.docpipeline.common.process.ProcessExecutor.ProcessResult;
import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Renders pages with poppler's {@code pdftoppm}, reading the page count from {@code pdfinfo}.
 *
 * <p>Output files are waited on through the process exit code only: after a successful exit every
 * page image must already exist at its known path, otherwise the run is a conversion failure.
 */
@Service
@ConditionalOnProperty(name = "pipeline.rasterizer.engine", havingValue = "pdftoppm")
@Slf4j
public class PdftoppmPageRasterizer implements PageRasterizer {

  static final String ENGINE = "pdftoppm";
  private static final String OUTPUT_PREFIX = "page";

  private final ProcessExecutor processExecutor;
  private final WorkspaceStorage workspaceStorage;
  private final DownstreamGuard guard;
  private final PipelineConfig.Rasterizer settings;
  private final PageCountProbe probe;

  public PdftoppmPageRasterizer(
      ProcessExecutor processExecutor,
      WorkspaceStorage workspaceStorage,
      @Qualifier(DownstreamGuard.RASTERIZER) DownstreamGuard guard,
      PipelineConfig pipelineConfig) {
    this.processExecutor = processExecutor;
    this.workspaceStorage = workspaceStorage;
    this.guard = guard;
    this.settings = pipelineConfig.getRasterizer();
    this.probe =
        new PageCountProbe(
            processExecutor,
            settings.getPdftoppmCommand(),
            settings.getProbePageTimeout(),
            settings.getProbeMaxPages());
  }

  @Override
  public RasterizedDocument rasterize(byte[] pdfBytes, int dpi, String jobId) {
    if (pdfBytes == null || pdfBytes.length == 0) {
      throw new InvalidDocumentException(jobId, "Document is empty");
    }
    long startTime = System.currentTimeMillis();
    Path workDir = workspaceStorage.createWorkDirectory(jobId + "-raster");
    try {
      Path input = workDir.resolve("input.pdf");
      Files.write(input, pdfBytes);

      Map<String, String> metadata = readInfo(input, jobId);
      int pageCount = resolvePageCount(metadata, input, workDir, jobId);
      metadata.put(PdfMetadata.PAGES, String.valueOf(pageCount));

      List<PageImage> pages = renderPages(input, workDir, pageCount, dpi, jobId);
      log.info(
          "Rasterized {} pages at {} DPI for job {} in {}ms",
          pages.size(),
          dpi,
          jobId,
          System.currentTimeMillis() - startTime);
      return new RasterizedDocument(pageCount, metadata, pages);
    } catch (IOException e) {
      throw new UncheckedIOException("Work directory I/O failed for job " + jobId, e);
    } finally {
      workspaceStorage.release(workDir);
    }
  }

  @Override
  public String engineName() {
    return ENGINE;
  }

  Map<String, String> readInfo(Path input, String jobId) {
    ProcessResult result =
        guard.call(
            () ->
                processExecutor.run(
                    List.of(settings.getPdfinfoCommand(), input.toString()),
                    jobId,
                    settings.getToolTimeout(),
                    "pdfinfo"));
    if (!result.succeeded()) {
      throw new InvalidDocumentException(
          jobId, "Document is not a readable PDF: " + firstLine(result.stderr()));
    }
    return parsePdfinfo(result.stdout());
  }

  static Map<String, String> parsePdfinfo(String output) {
    Map<String, String> metadata = new LinkedHashMap<>();
    for (String line : output.split("\\R")) {
      int colon = line.indexOf(':');
      if (colon <= 0) {
        continue;
      }
      String key = PdfMetadata.keyForPdfinfoField(line.substring(0, colon).trim());
      if (key != null) {
        PdfMetadata.putIfPresent(metadata, key, line.substring(colon + 1));
      }
    }
    return metadata;
  }

  private int resolvePageCount(
      Map<String, String> metadata, Path input, Path workDir, String jobId) {
    String pages = metadata.get(PdfMetadata.PAGES);
    if (pages != null) {
      try {
        int count = Integer.parseInt(pages.trim());
        if (count > 0) {
          return count;
        }
      } catch (NumberFormatException e) {
        log.warn("Unparseable page count '{}' for job {}, probing", pages, jobId);
      }
    }
    int probed = probe.countPages(input, workDir, jobId);
    if (probed == 0) {
      throw new InvalidDocumentException(jobId, "Could not determine the page count");
    }
    return probed;
  }

  private List<PageImage> renderPages(
      Path input, Path workDir, int pageCount, int dpi, String jobId) throws IOException {
    List<String> command =
        List.of(
            settings.getPdftoppmCommand(),
            "-png",
            "-r",
            String.valueOf(dpi),
            "-aa",
            "yes",
            "-f",
            "1",
            "-l",
            String.valueOf(pageCount),
            input.toString(),
            workDir.resolve(OUTPUT_PREFIX).toString());
    ProcessResult result =
        guard.call(
            () -> {
              ProcessResult run =
                  processExecutor.run(command, jobId, settings.getToolTimeout(), ENGINE);
              if (!run.succeeded()) {
                throw new ConversionException(
                    ENGINE,
                    "pdftoppm exited with " + run.exitCode() + ": " + firstLine(run.stderr()));
              }
              return run;
            });
    log.debug("pdftoppm finished for job {} with exit code {}", jobId, result.exitCode());

    List<PageImage> pages = new ArrayList<>(pageCount);
    for (int page = 1; page <= pageCount; page++) {
      Path output = outputPath(workDir, page, pageCount);
      if (!Files.isRegularFile(output)) {
        throw new ConversionException(
            ENGINE, "pdftoppm exited successfully but " + output.getFileName() + " is missing");
      }
      pages.add(new PageImage(page, dpi, Files.readAllBytes(output)));
    }
    if (pages.isEmpty()) {
      throw new ConversionException(ENGINE, "pdftoppm produced no images for job " + jobId);
    }
    return pages;
  }

  /** pdftoppm zero-pads page numbers to the width of the page count. */
  static Path outputPath(Path workDir, int page, int pageCount) {
    int width = String.valueOf(pageCount).length();
    return workDir.resolve(String.format("%s-%0" + width + "d.png", OUTPUT_PREFIX, page));
  }

  private static String firstLine(String text) {
    if (text == null || text.isBlank()) {
      return "no output";
    }
    return text.lines().findFirst().orElse(text);
  }
}
