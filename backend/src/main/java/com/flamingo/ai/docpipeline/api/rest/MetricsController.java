package com.flamingo.ai.docpipeline.api.rest;

import com.flamingo.ai.docpipeline.api.dto.response.OperationalMetrics;
import com.flamingo.ai.docpipeline.service.health.OperationalStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the operational metrics summary. */
@RestController
@RequestMapping("/metrics")
@RequiredArgsConstructor
public class MetricsController {

  private final OperationalStatusService operationalStatusService;

  /** Returns request, page, chunk, breaker and worker pool counters. */
  @GetMapping
  public ResponseEntity<OperationalMetrics> metrics() {
    return ResponseEntity.ok(operationalStatusService.metrics());
  }
}
