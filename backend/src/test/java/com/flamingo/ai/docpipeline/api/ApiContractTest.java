package com.flamingo.ai.docpipeline.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docpipeline.api.rest.ChunkedJobController;
import com.flamingo.ai.docpipeline.api.rest.ExtractionController;
import com.flamingo.ai.docpipeline.api.rest.HealthController;
import com.flamingo.ai.docpipeline.api.rest.MetricsController;
import com.flamingo.ai.docpipeline.api.sse.ProgressController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests that pin controller base paths.
 *
 * <ul>
 *   <li>POST /api/extract - Whole-document OCR
 *   <li>GET /api/progress/{id} and /api/progress-stream/{id} - Progress
 *   <li>POST /api/upload, GET /api/status/{id}, GET /api/result/{id} - Chunked jobs
 *   <li>GET /health, GET /metrics - Operations
 * </ul>
 */
class ApiContractTest {

  private static String[] basePath(Class<?> controller) {
    RequestMapping mapping = controller.getAnnotation(RequestMapping.class);
    assertThat(mapping).isNotNull();
    return mapping.value();
  }

  @Nested
  @DisplayName("Pipeline API contract")
  class PipelineContract {

    @Test
    @DisplayName("extraction, progress and chunked job controllers are mapped under /api")
    void shouldBeMappedUnderApiPrefix() {
      assertThat(basePath(ExtractionController.class)).containsExactly("/api");
      assertThat(basePath(ProgressController.class)).containsExactly("/api");
      assertThat(basePath(ChunkedJobController.class)).containsExactly("/api");
    }
  }

  @Nested
  @DisplayName("Operations API contract")
  class OperationsContract {

    @Test
    @DisplayName("health and metrics are mapped at the root")
    void shouldBeMappedAtRoot() {
      assertThat(basePath(HealthController.class)).containsExactly("/health");
      assertThat(basePath(MetricsController.class)).containsExactly("/metrics");
    }
  }
}
