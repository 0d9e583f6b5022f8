package com.flamingo.ai.docpipeline.api.rest;

import com.flamingo.ai.docpipeline.api.dto.response.ServiceHealth;
import com.flamingo.ai.docpipeline.service.health.OperationalStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final OperationalStatusService operationalStatusService;

  /** Returns service health; {@code degraded} while a downstream breaker is not closed. */
  @GetMapping
  public ResponseEntity<ServiceHealth> health() {
    return ResponseEntity.ok(operationalStatusService.health());
  }
}
