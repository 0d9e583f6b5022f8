package com.flamingo.ai.docpipeline.service.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.enums.JobStatus;
import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.ChunkAnalysis;
import com.flamingo.ai.docpipeline.domain.model.ChunkResult;
import com.flamingo.ai.docpipeline.domain.model.JobSnapshot;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.domain.model.PageRange;
import com.flamingo.ai.docpipeline.domain.model.PageResult;
import com.flamingo.ai.docpipeline.domain.model.RasterizedDocument;
import com.flamingo.ai.docpipeline.domain.store.InMemoryJobStore;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import com.flamingo.ai.docpipeline.exception.JobNotFoundException;
import com.flamingo.ai.docpipeline.exception.JobNotReadyException;
import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisService;
import com.flamingo.ai.docpipeline.service.analysis.OcrChunkAnalysisProvider;
import com.flamingo.ai.docpipeline.service.chunking.PdfChunker;
import com.flamingo.ai.docpipeline.service.ocr.OcrEngine;
import com.flamingo.ai.docpipeline.service.ocr.OcrWorkerPool;
import com.flamingo.ai.docpipeline.service.progress.ProgressTracker;
import com.flamingo.ai.docpipeline.service.rasterize.PageRasterizer;
import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JobOrchestratorTest {

  @Mock private ChunkAnalysisService chunkAnalysisService;

  @TempDir Path tempDir;

  private InMemoryJobStore jobStore;
  private ProgressTracker progressTracker;
  private SimpleMeterRegistry meterRegistry;
  private List<Runnable> queued;

  @BeforeEach
  void setUp() {
    jobStore = new InMemoryJobStore();
    progressTracker = new ProgressTracker(Duration.ofMillis(10), Clock.systemUTC());
    meterRegistry = new SimpleMeterRegistry();
    queued = Collections.synchronizedList(new ArrayList<>());

    when(chunkAnalysisService.analyze(any(), any()))
        .thenAnswer(
            invocation -> {
              Chunk chunk = invocation.getArgument(0);
              return new ChunkAnalysis("pages " + chunk.startPage(), 85, "tesseract", 0);
            });
  }

  @Test
  @DisplayName("chunks finishing in reverse order still yield start-page ordered results")
  void shouldOrderResultsByStartPage() {
    JobOrchestrator orchestrator = orchestrator(queued::add);
    String jobId = orchestrator.createJob("big.pdf", 45, chunks(45, 20, 2), null);

    orchestrator.submitAll(jobId);
    for (int i = queued.size() - 1; i >= 0; i--) {
      queued.get(i).run();
    }

    JobSnapshot result = orchestrator.getResult(jobId);
    assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(result.results()).extracting(ChunkResult::startPage).containsExactly(1, 19, 37);
    assertThat(result.results())
        .extracting(ChunkResult::content)
        .containsExactly("pages 1", "pages 19", "pages 37");
    assertThat(progressTracker.snapshot(jobId).percentage()).isEqualTo(100.0);
  }

  @Test
  @DisplayName("result is not available while chunks are outstanding")
  void shouldRejectResultWhileProcessing() {
    JobOrchestrator orchestrator = orchestrator(queued::add);
    String jobId = orchestrator.createJob("big.pdf", 45, chunks(45, 20, 2), null);
    orchestrator.submitAll(jobId);
    queued.get(0).run();

    assertThat(orchestrator.getStatus(jobId).completedChunks()).isEqualTo(1);
    assertThatThrownBy(() -> orchestrator.getResult(jobId))
        .isInstanceOf(JobNotReadyException.class);
  }

  @Test
  @DisplayName("finalizes exactly once when chunks complete concurrently")
  void shouldFinalizeOnce_underConcurrency() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      JobOrchestrator orchestrator = orchestrator(pool);
      String jobId = orchestrator.createJob("huge.pdf", 400, chunks(400, 5, 1), null);

      orchestrator.submitAll(jobId);
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

      JobSnapshot snapshot = orchestrator.getStatus(jobId);
      assertThat(snapshot.status()).isEqualTo(JobStatus.COMPLETED);
      assertThat(snapshot.completedChunks()).isEqualTo(snapshot.totalChunks());
      assertThat(
              meterRegistry
                  .counter("pipeline_jobs_finalized_total", "status", "completed")
                  .count())
          .isEqualTo(1.0);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("a failing chunk ends the job in error with partial results")
  void shouldKeepPartialResults_whenChunkFails() {
    doThrow(new ConversionException("tesseract", "tesseract exited with 1"))
        .when(chunkAnalysisService)
        .analyze(argThat(chunk -> chunk != null && chunk.startPage() == 19), any());
    JobOrchestrator orchestrator = orchestrator(Runnable::run);
    String jobId = orchestrator.createJob("big.pdf", 45, chunks(45, 20, 2), null);

    orchestrator.submitAll(jobId);

    JobSnapshot result = orchestrator.getResult(jobId);
    assertThat(result.status()).isEqualTo(JobStatus.ERROR);
    assertThat(result.errorMessage()).contains("chunk-002").contains("tesseract exited with 1");
    assertThat(result.results()).hasSize(3);
    assertThat(result.results().get(1).failed()).isTrue();
    assertThat(result.results().get(0).content()).isEqualTo("pages 1");
    assertThat(progressTracker.snapshot(jobId).status()).isEqualTo(JobStatus.ERROR);
    assertThat(meterRegistry.counter("pipeline_jobs_finalized_total", "status", "error").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("a page refused by the open OCR breaker fails its chunk and the job")
  void shouldFailJob_whenOcrBreakerRefusesPage() throws IOException {
    PipelineConfig config = new PipelineConfig();
    PageRasterizer rasterizer = mock(PageRasterizer.class);
    List<PageImage> pages =
        IntStream.rangeClosed(1, 10).mapToObj(i -> new PageImage(i, 200, new byte[] {1})).toList();
    when(rasterizer.rasterize(any(), anyInt(), anyString()))
        .thenReturn(new RasterizedDocument(10, Map.of(), pages));
    OcrEngine engine = mock(OcrEngine.class);
    when(engine.engineName()).thenReturn("tesseract");
    when(engine.recognize(any(), anyString()))
        .thenAnswer(
            invocation -> {
              PageImage page = invocation.getArgument(0);
              if (page.pageNumber() == 3) {
                throw new DownstreamUnavailableException("ocr", "Circuit breaker 'ocr' is OPEN");
              }
              return PageResult.success(page.pageNumber(), "text" + page.pageNumber(), 95);
            });
    OcrWorkerPool workerPool = new OcrWorkerPool(engine, Runnable::run, meterRegistry, config);
    CircuitBreaker analysisBreaker =
        CircuitBreaker.of("analysis", DownstreamGuard.toConfig(new PipelineConfig.Breaker()));
    ChunkAnalysisService analysisService =
        new ChunkAnalysisService(
            new OcrChunkAnalysisProvider(rasterizer, workerPool, config, meterRegistry),
            new DownstreamGuard(analysisBreaker, meterRegistry),
            config);
    Path file = Files.writeString(tempDir.resolve("chunk-001_p1-10.pdf"), "%PDF-");
    Chunk chunk = new Chunk("chunk-001", file, new PageRange(1, 10), 5);
    JobOrchestrator orchestrator =
        new JobOrchestrator(
            jobStore,
            analysisService,
            progressTracker,
            new WorkspaceStorage(tempDir),
            Runnable::run,
            meterRegistry,
            Clock.systemUTC());

    String jobId = orchestrator.createJob("scan.pdf", 10, List.of(chunk), null);
    orchestrator.submitAll(jobId);

    JobSnapshot result = orchestrator.getResult(jobId);
    assertThat(result.status()).isEqualTo(JobStatus.ERROR);
    assertThat(result.results()).hasSize(1);
    assertThat(result.results().get(0).failed()).isTrue();
    assertThat(result.results().get(0).error()).contains("pages [3]").contains("is OPEN");
    assertThat(result.errorMessage()).contains("chunk-001");
    assertThat(progressTracker.snapshot(jobId).status()).isEqualTo(JobStatus.ERROR);
  }

  @Test
  @DisplayName("a chunk the executor rejects is recorded as failed")
  void shouldRecordRejectedChunkAsFailed() {
    JobOrchestrator orchestrator =
        orchestrator(
            task -> {
              throw new RejectedExecutionException("queue full");
            });
    String jobId = orchestrator.createJob("a.pdf", 3, chunks(3, 20, 2), null);

    orchestrator.submitAll(jobId);

    JobSnapshot result = orchestrator.getResult(jobId);
    assertThat(result.status()).isEqualTo(JobStatus.ERROR);
    assertThat(result.results().get(0).error()).isEqualTo("Processing queue is full");
  }

  @Test
  @DisplayName("finalizing removes the chunk files and the job directory")
  void shouldReleaseWorkDirectory() throws IOException {
    Path workDir = Files.createDirectory(tempDir.resolve("job"));
    Path file = Files.writeString(workDir.resolve("chunk-001_p1-3.pdf"), "%PDF-");
    Chunk chunk = new Chunk("chunk-001", file, new PageRange(1, 3), 5);
    JobOrchestrator orchestrator = orchestrator(Runnable::run);

    String jobId = orchestrator.createJob("a.pdf", 3, List.of(chunk), workDir);
    orchestrator.submitAll(jobId);

    assertThat(file).doesNotExist();
    assertThat(workDir).doesNotExist();
  }

  @Test
  @DisplayName("unknown job ids are reported as not found")
  void shouldThrowForUnknownJob() {
    JobOrchestrator orchestrator = orchestrator(Runnable::run);

    assertThatThrownBy(() -> orchestrator.getStatus("missing"))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  @DisplayName("a caller-chosen job id cannot be reused")
  void shouldRejectDuplicateJobId() {
    JobOrchestrator orchestrator = orchestrator(queued::add);
    orchestrator.createJob("fixed", "a.pdf", 3, chunks(3, 20, 2), null);

    assertThatThrownBy(() -> orchestrator.createJob("fixed", "b.pdf", 3, chunks(3, 20, 2), null))
        .isInstanceOf(IllegalStateException.class);
  }

  private JobOrchestrator orchestrator(Executor executor) {
    return new JobOrchestrator(
        jobStore,
        chunkAnalysisService,
        progressTracker,
        new WorkspaceStorage(tempDir),
        executor,
        meterRegistry,
        Clock.systemUTC());
  }

  private List<Chunk> chunks(int totalPages, int size, int overlap) {
    List<Chunk> chunks = new ArrayList<>();
    List<PageRange> windows = PdfChunker.planWindows(totalPages, size, overlap);
    for (int i = 0; i < windows.size(); i++) {
      String id = String.format("chunk-%03d", i + 1);
      chunks.add(new Chunk(id, tempDir.resolve(id + ".pdf"), windows.get(i), 0));
    }
    return chunks;
  }
}
