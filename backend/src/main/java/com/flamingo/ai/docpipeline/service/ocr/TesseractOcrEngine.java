package com.flamingo.ai.docpipeline.service.ocr;

import com.flamingo.ai.docpipeline.common.process.ProcessExecutor;
import com.flamingo.ai.docpipeline.common.process.ProcessExecutor.ProcessResult;
import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.PageResult;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** OCR through the Tesseract command-line tool, guarded by the {@code ocr} circuit breaker. */
@Service
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

  static final String ENGINE = "tesseract";

  private final ProcessExecutor processExecutor;
  private final WorkspaceStorage workspaceStorage;
  private final DownstreamGuard guard;
  private final PipelineConfig.Ocr settings;

  public TesseractOcrEngine(
      ProcessExecutor processExecutor,
      WorkspaceStorage workspaceStorage,
      @Qualifier(DownstreamGuard.OCR) DownstreamGuard guard,
      PipelineConfig pipelineConfig) {
    this.processExecutor = processExecutor;
    this.workspaceStorage = workspaceStorage;
    this.guard = guard;
    this.settings = pipelineConfig.getOcr();
  }

  @Override
  public PageResult recognize(PageImage page, String jobId) {
    Path workDir = workspaceStorage.createWorkDirectory(jobId + "-ocr-" + page.pageNumber());
    try {
      Path image = workDir.resolve("page.png");
      Files.write(image, page.png());
      Path outputBase = workDir.resolve("page");
      Path tsv = workDir.resolve("page.tsv");

      guard.call(
          () -> {
            ProcessResult result =
                processExecutor.run(
                    command(image, outputBase), jobId, settings.getPageTimeout(), ENGINE);
            if (!result.succeeded()) {
              throw new ConversionException(
                  ENGINE,
                  "tesseract exited with " + result.exitCode() + " on page " + page.pageNumber());
            }
            if (!Files.isRegularFile(tsv)) {
              throw new ConversionException(
                  ENGINE, "tesseract exited successfully but produced no output");
            }
            return result;
          });

      TesseractTsvParser.ParsedPage parsed =
          TesseractTsvParser.parse(Files.readString(tsv, StandardCharsets.UTF_8));
      log.debug(
          "OCR page {} of job {}: {} words, confidence {}",
          page.pageNumber(),
          jobId,
          parsed.wordCount(),
          String.format("%.1f", parsed.confidence()));
      return PageResult.success(page.pageNumber(), parsed.text(), parsed.confidence());
    } catch (IOException e) {
      throw new UncheckedIOException("OCR scratch I/O failed for page " + page.pageNumber(), e);
    } finally {
      workspaceStorage.release(workDir);
    }
  }

  @Override
  public String engineName() {
    return ENGINE;
  }

  List<String> command(Path image, Path outputBase) {
    return List.of(
        settings.getTesseractCommand(),
        image.toString(),
        outputBase.toString(),
        "-l",
        settings.getLanguage(),
        "--oem",
        String.valueOf(settings.getEngineMode()),
        "--psm",
        String.valueOf(settings.getPageSegmentationMode()),
        "tsv");
  }
}
