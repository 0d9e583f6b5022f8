package com.flamingo.ai.docpipeline.api.rest;

import com.flamingo.ai.docpipeline.api.dto.response.ExtractionResponse;
import com.flamingo.ai.docpipeline.service.extraction.ExtractionService;
import com.flamingo.ai.docpipeline.service.extraction.ExtractionTicket;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for whole-document OCR extraction. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ExtractionController {

  public static final String JOB_ID_HEADER = "X-Job-ID";

  private final ExtractionService extractionService;

  /**
   * Extracts the text of a PDF. The job id is sent as a header before the result is ready, so
   * progress can be followed while the request is pending.
   */
  @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public CompletableFuture<ResponseEntity<ExtractionResponse>> extract(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "dpi", required = false) Integer dpi,
      @RequestParam(value = "job_id", required = false) String jobId,
      HttpServletResponse response) {
    ExtractionTicket ticket = extractionService.submit(file, dpi, jobId);
    response.setHeader(JOB_ID_HEADER, ticket.jobId());
    return ticket
        .result()
        .thenApply(
            result ->
                ResponseEntity.ok()
                    .header(JOB_ID_HEADER, ticket.jobId())
                    .body(ExtractionResponse.from(result)));
  }
}
