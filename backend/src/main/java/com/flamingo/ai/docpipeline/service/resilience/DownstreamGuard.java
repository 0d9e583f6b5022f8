package com.flamingo.ai.docpipeline.service.resilience;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Guards one downstream call-site with a circuit breaker shared by every caller of that site.
 *
 * <p>The breaker opens after {@code failureThreshold} consecutive failures, rejects calls until
 * {@code resetTimeout} has passed, then lets a single probe through. A successful probe closes it,
 * a failed probe opens it again. Open-state rejections surface as {@link
 * DownstreamUnavailableException}; the guard never retries.
 */
@Slf4j
public class DownstreamGuard {

  public static final String OCR = "ocr";
  public static final String RASTERIZER = "rasterizer";
  public static final String ANALYSIS = "analysis";

  private final CircuitBreaker circuitBreaker;
  private final MeterRegistry meterRegistry;

  public DownstreamGuard(CircuitBreaker circuitBreaker, MeterRegistry meterRegistry) {
    this.circuitBreaker = circuitBreaker;
    this.meterRegistry = meterRegistry;
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event -> {
              log.warn(
                  "Circuit breaker '{}' {}",
                  event.getCircuitBreakerName(),
                  event.getStateTransition());
              if (event.getStateTransition().getToState() == CircuitBreaker.State.OPEN) {
                meterRegistry
                    .counter("pipeline_breaker_trips_total", "breaker", circuitBreaker.getName())
                    .increment();
              }
            });
  }

  /**
   * Maps breaker settings onto a resilience4j configuration.
   *
   * <p>A count-based window of {@code failureThreshold} calls that trips at a 100% failure rate is
   * equivalent to "N consecutive failures". The half-open timeout bounds how long the single probe
   * may stay in flight before the breaker re-opens.
   */
  public static CircuitBreakerConfig toConfig(PipelineConfig.Breaker settings) {
    int threshold = Math.max(1, settings.getFailureThreshold());
    return CircuitBreakerConfig.custom()
        .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(threshold)
        .minimumNumberOfCalls(threshold)
        .failureRateThreshold(100.0f)
        .waitDurationInOpenState(settings.getResetTimeout())
        .permittedNumberOfCallsInHalfOpenState(1)
        .maxWaitDurationInHalfOpenState(settings.getHalfOpenTimeout())
        .automaticTransitionFromOpenToHalfOpenEnabled(false)
        .ignoreExceptions(InvalidDocumentException.class)
        .build();
  }

  /**
   * Runs the call through the breaker.
   *
   * @throws DownstreamUnavailableException when the breaker rejects the call
   */
  public <T> T call(Supplier<T> call) {
    try {
      return circuitBreaker.executeSupplier(call);
    } catch (CallNotPermittedException e) {
      meterRegistry
          .counter("pipeline_breaker_rejections_total", "breaker", circuitBreaker.getName())
          .increment();
      throw new DownstreamUnavailableException(
          circuitBreaker.getName(),
          "Circuit breaker '" + circuitBreaker.getName() + "' is " + circuitBreaker.getState(),
          e);
    }
  }

  public String getName() {
    return circuitBreaker.getName();
  }

  public CircuitBreaker.State getState() {
    return circuitBreaker.getState();
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }
}
