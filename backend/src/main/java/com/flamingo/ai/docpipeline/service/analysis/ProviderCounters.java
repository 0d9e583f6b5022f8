package com.flamingo.ai.docpipeline.service.analysis;

import com.flamingo.ai.docpipeline.service.analysis.ChunkAnalysisProvider.ProviderStats;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicLong;

/** Request, success, failure and token counters for one provider, mirrored into Micrometer. */
class ProviderCounters {

  private final String provider;
  private final MeterRegistry meterRegistry;
  private final AtomicLong requests = new AtomicLong();
  private final AtomicLong successes = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();
  private final AtomicLong tokens = new AtomicLong();

  ProviderCounters(String provider, MeterRegistry meterRegistry) {
    this.provider = provider;
    this.meterRegistry = meterRegistry;
  }

  void request() {
    requests.incrementAndGet();
    meterRegistry.counter("pipeline_analysis_requests_total", "provider", provider).increment();
  }

  void success(long tokensUsed) {
    successes.incrementAndGet();
    meterRegistry
        .counter("pipeline_analysis_results_total", "provider", provider, "outcome", "success")
        .increment();
    if (tokensUsed > 0) {
      tokens.addAndGet(tokensUsed);
      meterRegistry
          .counter("pipeline_analysis_tokens_total", "provider", provider)
          .increment(tokensUsed);
    }
  }

  void failure() {
    failures.incrementAndGet();
    meterRegistry
        .counter("pipeline_analysis_results_total", "provider", provider, "outcome", "failure")
        .increment();
  }

  ProviderStats snapshot() {
    return new ProviderStats(requests.get(), successes.get(), failures.get(), tokens.get());
  }
}
