package com.flamingo.ai.docpipeline.service.ocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.OcrDocumentResult;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.PageResult;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.springframework.core.task.TaskRejectedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OcrWorkerPoolTest {

  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private PipelineConfig config;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    meterRegistry = new SimpleMeterRegistry();
    config = new PipelineConfig();
    config.getOcr().setMaxWorkers(4);
    config.getOcr().setBatchSize(3);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("returns results in page order even when early pages finish last")
  void shouldReturnResultsInPageOrder() {
    OcrWorkerPool pool =
        pool(
            page -> {
              sleep((10 - page.pageNumber()) * 15L);
              return PageResult.success(page.pageNumber(), "text " + page.pageNumber(), 90);
            });

    OcrDocumentResult result = pool.processDocument(pages(10), "job-1", PageProgressListener.NONE);

    assertThat(result.pages())
        .extracting(PageResult::pageNumber)
        .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    assertThat(result.text()).startsWith("text 1\ntext 2\n").endsWith("text 10");
    assertThat(result.confidence()).isEqualTo(90.0);
  }

  @Test
  @DisplayName("progress callbacks add up to the page count, one per batch")
  void shouldReportProgressPerBatch() {
    OcrWorkerPool pool = pool(page -> PageResult.success(page.pageNumber(), "x", 80));
    AtomicInteger processed = new AtomicInteger();
    List<Integer> calls = new ArrayList<>();

    pool.processDocument(
        pages(10),
        "job-2",
        count -> {
          processed.addAndGet(count);
          synchronized (calls) {
            calls.add(count);
          }
        });

    assertThat(processed.get()).isEqualTo(10);
    assertThat(calls).hasSize(4).containsExactlyInAnyOrder(3, 3, 3, 1);
  }

  @Test
  @DisplayName("a failing page gets zero confidence without aborting the others")
  void shouldIsolatePageFailures() {
    OcrWorkerPool pool =
        pool(
            page -> {
              if (page.pageNumber() == 2) {
                throw new IllegalStateException("engine crashed");
              }
              return PageResult.success(page.pageNumber(), "ok", 90);
            });

    OcrDocumentResult result = pool.processDocument(pages(3), "job-3", PageProgressListener.NONE);

    assertThat(result.pages()).hasSize(3);
    PageResult failed = result.pages().get(1);
    assertThat(failed.failed()).isTrue();
    assertThat(failed.confidence()).isZero();
    assertThat(failed.text()).isEmpty();
    assertThat(failed.error()).isEqualTo("engine crashed");
    assertThat(result.failedPages()).containsExactly(2);
    assertThat(result.confidence()).isEqualTo(60.0);
    assertThat(meterRegistry.counter("pipeline_page_failures_total").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("pipeline_pages_processed_total").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("a page refused by the open breaker fails the document after all pages ran")
  void shouldFailDocument_whenBreakerRefusesPage() {
    AtomicInteger recognized = new AtomicInteger();
    AtomicInteger processed = new AtomicInteger();
    OcrWorkerPool pool =
        pool(
            page -> {
              recognized.incrementAndGet();
              if (page.pageNumber() == 3) {
                throw new DownstreamUnavailableException("ocr", "Circuit breaker 'ocr' is OPEN");
              }
              return PageResult.success(page.pageNumber(), "text" + page.pageNumber(), 95);
            });

    assertThatThrownBy(() -> pool.processDocument(pages(10), "job-8", processed::addAndGet))
        .isInstanceOf(DownstreamUnavailableException.class)
        .hasMessageContaining("pages [3]")
        .hasMessageContaining("is OPEN")
        .satisfies(
            e -> assertThat(((DownstreamUnavailableException) e).getDependency()).isEqualTo("ocr"));
    assertThat(recognized.get()).isEqualTo(10);
    assertThat(processed.get()).isEqualTo(10);
    assertThat(meterRegistry.counter("pipeline_page_failures_total").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("an executor rejection cancels the pages already queued")
  void shouldCancelQueuedPages_whenExecutorRejects() {
    List<Runnable> accepted = new ArrayList<>();
    Executor saturated =
        task -> {
          if (accepted.size() == 4) {
            throw new TaskRejectedException("ocr queue full");
          }
          accepted.add(task);
        };
    AtomicInteger recognized = new AtomicInteger();
    AtomicInteger progressCalls = new AtomicInteger();
    OcrWorkerPool pool =
        pool(
            page -> {
              recognized.incrementAndGet();
              return PageResult.success(page.pageNumber(), "ok", 90);
            },
            saturated);

    assertThatThrownBy(
            () -> pool.processDocument(pages(10), "job-9", n -> progressCalls.incrementAndGet()))
        .isInstanceOf(TaskRejectedException.class);
    accepted.forEach(Runnable::run);

    assertThat(accepted).hasSize(4);
    assertThat(recognized.get()).isZero();
    assertThat(progressCalls.get()).isZero();
  }

  @Test
  @DisplayName("a throwing progress listener does not fail the document")
  void shouldTolerateFailingListener() {
    OcrWorkerPool pool = pool(page -> PageResult.success(page.pageNumber(), "ok", 70));

    OcrDocumentResult result =
        pool.processDocument(
            pages(4),
            "job-4",
            count -> {
              throw new IllegalStateException("listener broke");
            });

    assertThat(result.failedPages()).isEmpty();
  }

  @Test
  @DisplayName("runs no more pages at once than there are workers")
  void shouldBoundConcurrency() {
    AtomicInteger running = new AtomicInteger();
    Set<Integer> peaks = ConcurrentHashMap.newKeySet();
    OcrWorkerPool pool =
        pool(
            page -> {
              peaks.add(running.incrementAndGet());
              sleep(20);
              running.decrementAndGet();
              return PageResult.success(page.pageNumber(), "ok", 70);
            });

    pool.processDocument(pages(12), "job-5", PageProgressListener.NONE);

    assertThat(peaks).allMatch(peak -> peak <= 4);
  }

  @Test
  @DisplayName("an empty document yields an empty result without progress calls")
  void shouldHandleEmptyDocument() {
    OcrWorkerPool pool = pool(page -> PageResult.success(page.pageNumber(), "x", 1));
    AtomicInteger calls = new AtomicInteger();

    OcrDocumentResult result =
        pool.processDocument(List.of(), "job-6", n -> calls.incrementAndGet());

    assertThat(result.pages()).isEmpty();
    assertThat(result.confidence()).isZero();
    assertThat(calls.get()).isZero();
  }

  @Test
  @DisplayName("requires a progress listener")
  void shouldRejectNullListener() {
    OcrWorkerPool pool = pool(page -> PageResult.success(page.pageNumber(), "x", 1));

    assertThatThrownBy(() -> pool.processDocument(pages(1), "job-7", null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  @DisplayName("batch size defaults to the worker limit")
  void shouldDefaultBatchSizeToMaxWorkers() {
    config.getOcr().setBatchSize(0);

    assertThat(pool(page -> PageResult.success(page.pageNumber(), "x", 1)).getBatchSize())
        .isEqualTo(4);
  }

  private OcrWorkerPool pool(Function<PageImage, PageResult> recognizer) {
    return pool(recognizer, executor);
  }

  private OcrWorkerPool pool(Function<PageImage, PageResult> recognizer, Executor ocrExecutor) {
    OcrEngine engine =
        new OcrEngine() {
          @Override
          public PageResult recognize(PageImage page, String jobId) {
            return recognizer.apply(page);
          }

          @Override
          public String engineName() {
            return "fake";
          }
        };
    return new OcrWorkerPool(engine, ocrExecutor, meterRegistry, config);
  }

  private static List<PageImage> pages(int count) {
    return IntStream.rangeClosed(1, count)
        .mapToObj(i -> new PageImage(i, 200, new byte[] {1, 2, 3}))
        .toList();
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
