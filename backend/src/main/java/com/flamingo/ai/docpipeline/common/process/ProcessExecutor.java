package com.flamingo.ai.docpipeline.common.process;

import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external command-line tools with a hard timeout. Output streams are drained on background
 * threads so a chatty process can never block on a full pipe.
 */
@Component
@Slf4j
public class ProcessExecutor implements DisposableBean {

  /** Upper bound on captured stdout/stderr per stream. */
  static final int MAX_CAPTURE_CHARS = 64 * 1024;

  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final ExecutorService streamDrainers;

  public ProcessExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("proc-io-");
    threadFactory.setDaemon(true);
    this.streamDrainers = Executors.newCachedThreadPool(threadFactory);
  }

  /**
   * Executes a command and waits for it to exit.
   *
   * @param command the command and its arguments
   * @param contextInfo logging context, usually a job id
   * @param timeout how long to wait before killing the process
   * @param processName short tool name for logs and errors
   * @return exit code plus the captured (possibly truncated) stdout and stderr
   * @throws ProcessTimeoutException if the process had to be killed
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public ProcessResult execute(
      List<String> command, String contextInfo, Duration timeout, String processName)
      throws IOException, InterruptedException {

    log.debug("[{}] Running {}: {}", contextInfo, processName, command);
    Process process = new ProcessBuilder(command).start();
    process.getOutputStream().close();

    StreamCapture stdout = new StreamCapture(process.getInputStream(), null);
    StreamCapture stderr =
        new StreamCapture(
            process.getErrorStream(),
            line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line));
    Future<?> stdoutTask = streamDrainers.submit(stdout);
    Future<?> stderrTask = streamDrainers.submit(stderr);

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new ProcessTimeoutException(processName, timeout);
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }

    awaitDrain(stdoutTask, contextInfo, processName);
    awaitDrain(stderrTask, contextInfo, processName);
    return new ProcessResult(process.exitValue(), stdout.captured(), stderr.captured());
  }

  /**
   * Like {@link #execute} but maps failures onto the pipeline's error kinds: a timeout becomes
   * {@link DownstreamUnavailableException}, anything else that stops the tool from running becomes
   * {@link ConversionException}. A non-zero exit code is returned, not thrown.
   */
  public ProcessResult run(
      List<String> command, String contextInfo, Duration timeout, String processName) {
    try {
      return execute(command, contextInfo, timeout, processName);
    } catch (ProcessTimeoutException e) {
      throw new DownstreamUnavailableException(processName, e.getMessage(), e);
    } catch (IOException e) {
      throw new ConversionException(processName, "Failed to run " + processName, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConversionException(processName, processName + " interrupted", e);
    }
  }

  private void awaitDrain(Future<?> task, String contextInfo, String processName)
      throws InterruptedException {
    try {
      task.get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException e) {
      log.warn(
          "[{}] Incomplete output capture for {}: {}", contextInfo, processName, e.getMessage());
    }
  }

  @Override
  public void destroy() {
    streamDrainers.shutdownNow();
  }

  /** Reads a stream to exhaustion, keeping at most {@link #MAX_CAPTURE_CHARS} characters. */
  private static final class StreamCapture implements Runnable {
    private final InputStream inputStream;
    private final Consumer<String> lineLogger;
    private final StringBuilder buffer = new StringBuilder();

    StreamCapture(InputStream inputStream, Consumer<String> lineLogger) {
      this.inputStream = inputStream;
      this.lineLogger = lineLogger;
    }

    @Override
    public void run() {
      try (BufferedReader reader =
          new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (lineLogger != null) {
            lineLogger.accept(line);
          }
          synchronized (buffer) {
            if (buffer.length() < MAX_CAPTURE_CHARS) {
              buffer.append(line).append('\n');
            }
          }
        }
      } catch (IOException e) {
        log.error("Error reading process stream.", e);
      }
    }

    String captured() {
      synchronized (buffer) {
        return buffer.toString().trim();
      }
    }
  }

  /**
   * Result of an external process execution.
   *
   * @param exitCode process exit code, 0 on success
   * @param stdout captured standard output (truncated)
   * @param stderr captured standard error (truncated)
   */
  public record ProcessResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
