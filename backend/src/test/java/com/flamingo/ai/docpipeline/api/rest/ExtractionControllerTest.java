package com.flamingo.ai.docpipeline.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docpipeline.exception.ApiError;
import com.flamingo.ai.docpipeline.exception.ConversionException;
import com.flamingo.ai.docpipeline.exception.GlobalExceptionHandler;
import com.flamingo.ai.docpipeline.exception.InvalidDocumentException;
import com.flamingo.ai.docpipeline.service.extraction.ExtractionResult;
import com.flamingo.ai.docpipeline.service.extraction.ExtractionService;
import com.flamingo.ai.docpipeline.service.extraction.ExtractionTicket;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExtractionController Tests")
class ExtractionControllerTest {

  private MockMvc mockMvc;

  @Mock private ExtractionService extractionService;

  private final MockMultipartFile file =
      new MockMultipartFile("file", "scan.pdf", "application/pdf", "%PDF-1.7".getBytes());

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ExtractionController(extractionService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  private static ExtractionResult result() {
    return new ExtractionResult(
        "job-1",
        "scan.pdf",
        "application/pdf",
        "Hello\nWorld",
        87.456,
        2,
        300,
        4,
        "pdfbox",
        1.234,
        List.of(),
        Map.of("title", "Quarterly report"));
  }

  @Test
  @DisplayName("returns text, confidence and metadata with the job id header")
  void shouldReturnExtraction() throws Exception {
    when(extractionService.submit(any(), eq(300), isNull()))
        .thenReturn(new ExtractionTicket("job-1", CompletableFuture.completedFuture(result())));

    MvcResult pending =
        mockMvc
            .perform(multipart("/api/extract").file(file).param("dpi", "300"))
            .andExpect(request().asyncStarted())
            .andExpect(header().string(ExtractionController.JOB_ID_HEADER, "job-1"))
            .andReturn();

    mockMvc
        .perform(asyncDispatch(pending))
        .andExpect(status().isOk())
        .andExpect(header().string(ExtractionController.JOB_ID_HEADER, "job-1"))
        .andExpect(jsonPath("$.text").value("Hello\nWorld"))
        .andExpect(jsonPath("$.confidence").value(87.46))
        .andExpect(jsonPath("$.metadata.num_pages").value(2))
        .andExpect(jsonPath("$.metadata.filename").value("scan.pdf"))
        .andExpect(jsonPath("$.metadata.parallel_processed").value(true))
        .andExpect(jsonPath("$.metadata.processing_time_seconds").value(1.23))
        .andExpect(jsonPath("$.metadata.job_id").value("job-1"))
        .andExpect(jsonPath("$.metadata.dpi").value(300))
        .andExpect(jsonPath("$.metadata.title").value("Quarterly report"))
        .andExpect(jsonPath("$.metadata.author").doesNotExist());
  }

  @Test
  @DisplayName("maps a conversion failure to 422 once the extraction finishes")
  void shouldMapConversionFailure() throws Exception {
    when(extractionService.submit(any(), isNull(), eq("job-2")))
        .thenReturn(
            new ExtractionTicket(
                "job-2",
                CompletableFuture.failedFuture(
                    new ConversionException("pdfbox", "Rendering produced no images"))));

    MvcResult pending =
        mockMvc
            .perform(multipart("/api/extract").file(file).param("job_id", "job-2"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(pending))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.CONVERSION_FAILED));
  }

  @Test
  @DisplayName("rejects an invalid upload with 400 before starting")
  void shouldRejectInvalidUpload() throws Exception {
    when(extractionService.submit(any(), any(), any()))
        .thenThrow(new InvalidDocumentException("notes.txt", "Unsupported file type"));

    mockMvc
        .perform(multipart("/api/extract").file(file))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.INVALID_DOCUMENT));
  }

  @Test
  @DisplayName("rejects an out-of-range DPI with 400")
  void shouldRejectInvalidDpi() throws Exception {
    when(extractionService.submit(any(), eq(5000), any()))
        .thenThrow(new IllegalArgumentException("dpi must be between 1 and 600"));

    mockMvc
        .perform(multipart("/api/extract").file(file).param("dpi", "5000"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }
}
