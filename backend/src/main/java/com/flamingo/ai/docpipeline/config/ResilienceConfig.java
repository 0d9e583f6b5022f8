package com.flamingo.ai.docpipeline.config;

import com.flamingo.ai.docpipeline.service.resilience.DownstreamGuard;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** One circuit breaker per downstream call-site, registered for actuator visibility. */
@Configuration
public class ResilienceConfig {

  @Bean
  @Qualifier(DownstreamGuard.OCR)
  public DownstreamGuard ocrGuard(
      CircuitBreakerRegistry registry, PipelineConfig config, MeterRegistry meterRegistry) {
    return guard(DownstreamGuard.OCR, registry, config, meterRegistry);
  }

  @Bean
  @Qualifier(DownstreamGuard.RASTERIZER)
  public DownstreamGuard rasterizerGuard(
      CircuitBreakerRegistry registry, PipelineConfig config, MeterRegistry meterRegistry) {
    return guard(DownstreamGuard.RASTERIZER, registry, config, meterRegistry);
  }

  @Bean
  @Qualifier(DownstreamGuard.ANALYSIS)
  public DownstreamGuard analysisGuard(
      CircuitBreakerRegistry registry, PipelineConfig config, MeterRegistry meterRegistry) {
    return guard(DownstreamGuard.ANALYSIS, registry, config, meterRegistry);
  }

  private DownstreamGuard guard(
      String name,
      CircuitBreakerRegistry registry,
      PipelineConfig config,
      MeterRegistry meterRegistry) {
    return new DownstreamGuard(
        registry.circuitBreaker(name, DownstreamGuard.toConfig(config.breaker(name))),
        meterRegistry);
  }
}
