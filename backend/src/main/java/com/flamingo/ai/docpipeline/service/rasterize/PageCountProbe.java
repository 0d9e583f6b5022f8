package com.flamingo.ai.docpipeline.service.rasterize;

import com.flamingo.ai.docpipeline.common.process.ProcessExecutor;
import com.flamingo.ai.docpipeline.common.process.ProcessExecutor.ProcessResult;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Counts pages when the document metadata has no page count, by rendering page N+1 at a tiny
 * resolution until a page fails to appear. Each attempt has its own timeout and the number of
 * attempts is capped, so a corrupt file cannot block the caller indefinitely.
 */
@Slf4j
class PageCountProbe {

  private static final int PROBE_DPI = 10;

  private final ProcessExecutor processExecutor;
  private final String pdftoppmCommand;
  private final Duration pageTimeout;
  private final int maxPages;

  PageCountProbe(
      ProcessExecutor processExecutor, String pdftoppmCommand, Duration pageTimeout, int maxPages) {
    this.processExecutor = processExecutor;
    this.pdftoppmCommand = pdftoppmCommand;
    this.pageTimeout = pageTimeout;
    this.maxPages = maxPages;
  }

  /**
   * Returns the number of consecutive pages, starting at 1, that render successfully. Zero means
   * not even the first page could be rendered.
   */
  int countPages(Path pdf, Path workDir, String jobId) {
    int count = 0;
    for (int page = 1; page <= maxPages; page++) {
      if (!renders(pdf, workDir, page, jobId)) {
        break;
      }
      count = page;
    }
    if (count == maxPages) {
      log.warn("Page probe for job {} stopped at the cap of {} pages", jobId, maxPages);
    } else {
      log.info("Page probe for job {} found {} pages", jobId, count);
    }
    return count;
  }

  private boolean renders(Path pdf, Path workDir, int page, String jobId) {
    Path outputBase = workDir.resolve("probe-" + page);
    Path output = workDir.resolve("probe-" + page + ".png");
    List<String> command =
        List.of(
            pdftoppmCommand,
            "-f",
            String.valueOf(page),
            "-l",
            String.valueOf(page),
            "-r",
            String.valueOf(PROBE_DPI),
            "-png",
            "-singlefile",
            pdf.toString(),
            outputBase.toString());
    try {
      ProcessResult result = processExecutor.run(command, jobId, pageTimeout, "pdftoppm-probe");
      return result.succeeded() && Files.isRegularFile(output) && Files.size(output) > 0;
    } catch (DownstreamUnavailableException e) {
      log.warn("Page probe for job {} timed out on page {}", jobId, page);
      return false;
    } catch (IOException e) {
      log.warn("Page probe for job {} could not inspect page {}: {}", jobId, page, e.getMessage());
      return false;
    } finally {
      try {
        Files.deleteIfExists(output);
      } catch (IOException e) {
        log.debug("Could not delete probe output {}: {}", output, e.getMessage());
      }
    }
  }
}
