package com.flamingo.ai.docpipeline.service.health;

import com.flamingo.ai.docpipeline.api.dto.response.OperationalMetrics;
import com.flamingo.ai.docpipeline.api.dto.response.ServiceHealth;
import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisProvider;
import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisService;
import com.flamingo.ai.docpipeline.service.job.JobOrchestrator;
import com.flamingo.ai.docpipeline.service.ocr.OcrWorkerPool;
import com.flamingo.ai.docpipeline.service.progress.ProgressTracker;
import com.flamingo.ai.docpipeline.service.rasterize.PageRasterizer;
import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/** Builds the health check and the operational metrics summary. */
@Service
public class OperationalStatusService {

  private final List<DownstreamGuard> guards;
  private final Map<String, Executor> executors;
  private final OcrWorkerPool ocrWorkerPool;
  private final PageRasterizer pageRasterizer;
  private final ChunkAnalysisService chunkAnalysisService;
  private final JobOrchestrator jobOrchestrator;
  private final ProgressTracker progressTracker;
  private final MeterRegistry meterRegistry;
  private final String version;
  private final Clock clock;
  private final Instant startedAt;

  @Autowired
  public OperationalStatusService(
      List<DownstreamGuard> guards,
      @Qualifier("ocrExecutor") Executor ocrExecutor,
      @Qualifier("extractionExecutor") Executor extractionExecutor,
      @Qualifier("chunkProcessingExecutor") Executor chunkProcessingExecutor,
      OcrWorkerPool ocrWorkerPool,
      PageRasterizer pageRasterizer,
      ChunkAnalysisService chunkAnalysisService,
      JobOrchestrator jobOrchestrator,
      ProgressTracker progressTracker,
      MeterRegistry meterRegistry,
      @Value("${info.app.version:unknown}") String version) {
    this(
        guards,
        executorMap(ocrExecutor, extractionExecutor, chunkProcessingExecutor),
        ocrWorkerPool,
        pageRasterizer,
        chunkAnalysisService,
        jobOrchestrator,
        progressTracker,
        meterRegistry,
        version,
        Clock.systemUTC());
  }

  OperationalStatusService(
      List<DownstreamGuard> guards,
      Map<String, Executor> executors,
      OcrWorkerPool ocrWorkerPool,
      PageRasterizer pageRasterizer,
      ChunkAnalysisService chunkAnalysisService,
      JobOrchestrator jobOrchestrator,
      ProgressTracker progressTracker,
      MeterRegistry meterRegistry,
      String version,
      Clock clock) {
    this.guards = guards;
    this.executors = executors;
    this.ocrWorkerPool = ocrWorkerPool;
    this.pageRasterizer = pageRasterizer;
    this.chunkAnalysisService = chunkAnalysisService;
    this.jobOrchestrator = jobOrchestrator;
    this.progressTracker = progressTracker;
    this.meterRegistry = meterRegistry;
    this.version = version;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  /** Reports {@code degraded} while any breaker is open or half-open. */
  public ServiceHealth health() {
    Map<String, String> breakerStates = new TreeMap<>();
    boolean degraded = false;
    for (DownstreamGuard guard : guards) {
      CircuitBreaker.State state = guard.getState();
      breakerStates.put(guard.getName(), state.name().toLowerCase(Locale.ROOT));
      degraded |= state != CircuitBreaker.State.CLOSED;
    }

    int queued = 0;
    for (String name : List.of("ocr", "chunk_processing")) {
      ThreadPoolExecutor pool = pool(executors.get(name));
      if (pool != null) {
        queued += pool.getQueue().size();
      }
    }
    ThreadPoolExecutor ocrPool = pool(executors.get("ocr"));

    return ServiceHealth.builder()
        .status(degraded ? ServiceHealth.DEGRADED : ServiceHealth.HEALTHY)
        .version(version)
        .uptimeSeconds(uptime().toSeconds())
        .queueSize(queued)
        .activeWorkers(ocrPool == null ? 0 : ocrPool.getActiveCount())
        .lastProcessed(progressTracker.lastCompletedAt().orElse(null))
        .ocrEngine(ocrWorkerPool.engineName())
        .rasterizer(pageRasterizer.engineName())
        .analysisProvider(chunkAnalysisService.getProvider().name())
        .breakers(breakerStates)
        .build();
  }

  public OperationalMetrics metrics() {
    Map<String, OperationalMetrics.BreakerStats> breakerStats = new TreeMap<>();
    for (DownstreamGuard guard : guards) {
      CircuitBreaker.Metrics metrics = guard.getCircuitBreaker().getMetrics();
      breakerStats.put(
          guard.getName(),
          OperationalMetrics.BreakerStats.builder()
              .state(guard.getState().name().toLowerCase(Locale.ROOT))
              .failedCalls(metrics.getNumberOfFailedCalls())
              .successfulCalls(metrics.getNumberOfSuccessfulCalls())
              .rejectedCalls(metrics.getNumberOfNotPermittedCalls())
              .build());
    }

    Map<String, OperationalMetrics.ExecutorStats> executorStats = new LinkedHashMap<>();
    executors.forEach(
        (name, executor) -> {
          ThreadPoolExecutor pool = pool(executor);
          if (pool != null) {
            executorStats.put(
                name,
                OperationalMetrics.ExecutorStats.builder()
                    .poolSize(pool.getPoolSize())
                    .active(pool.getActiveCount())
                    .queued(pool.getQueue().size())
                    .completedTasks(pool.getCompletedTaskCount())
                    .build());
          }
        });

    ChunkAnalysisProvider provider = chunkAnalysisService.getProvider();
    ChunkAnalysisProvider.ProviderStats stats = provider.stats();

    return OperationalMetrics.builder()
        .uptimeSeconds(uptime().toSeconds())
        .totalRequests(
            meterRegistry.find("http.server.requests").timers().stream()
                .mapToLong(Timer::count)
                .sum())
        .errorResponses(sumCounters("api_errors_total"))
        .pagesProcessed(sumCounters("pipeline_pages_processed_total"))
        .pageFailures(sumCounters("pipeline_page_failures_total"))
        .documentsProcessed(countersByTag("pipeline_documents_processed_total", "outcome"))
        .chunksProcessed(countersByTag("pipeline_chunks_processed_total", "outcome"))
        .jobsFinalized(countersByTag("pipeline_jobs_finalized_total", "status"))
        .activeJobs(jobOrchestrator.activeJobs())
        .trackedProgressRecords(progressTracker.size())
        .executors(executorStats)
        .breakers(breakerStats)
        .analysis(
            OperationalMetrics.AnalysisStats.builder()
                .provider(provider.name())
                .requests(stats.requests())
                .successes(stats.successes())
                .failures(stats.failures())
                .tokensUsed(stats.tokensUsed())
                .build())
        .build();
  }

  private Duration uptime() {
    return Duration.between(startedAt, clock.instant());
  }

  private long sumCounters(String name) {
    return (long) meterRegistry.find(name).counters().stream().mapToDouble(Counter::count).sum();
  }

  private Map<String, Long> countersByTag(String name, String tag) {
    Map<String, Long> counts = new TreeMap<>();
    for (Counter counter : meterRegistry.find(name).counters()) {
      String value = counter.getId().getTag(tag);
      counts.merge(value == null ? "unknown" : value, (long) counter.count(), Long::sum);
    }
    return counts;
  }

  private static ThreadPoolExecutor pool(Executor executor) {
    if (executor instanceof ThreadPoolTaskExecutor taskExecutor) {
      return taskExecutor.getThreadPoolExecutor();
    }
    if (executor instanceof ThreadPoolExecutor threadPool) {
      return threadPool;
    }
    return null;
  }

  private static Map<String, Executor> executorMap(
      Executor ocrExecutor, Executor extractionExecutor, Executor chunkProcessingExecutor) {
    Map<String, Executor> executors = new LinkedHashMap<>();
    executors.put("ocr", ocrExecutor);
    executors.put("extraction", extractionExecutor);
    executors.put("chunk_processing", chunkProcessingExecutor);
    return executors;
  }
}
