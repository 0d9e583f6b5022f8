package com.flamingo.ai.docpipeline.api.rest;

import com.flamingo.ai.docpipeline.api.dto.response.JobResultResponse;
import com.flamingo.ai.docpipeline.api.dto.response.JobStatusResponse;
import com.flamingo.ai.docpipeline.api.dto.response.UploadResponse;
import com.flamingo.ai.docpipeline.service.job.ChunkedJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for chunked processing of large PDFs. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChunkedJobController {

  private final ChunkedJobService chunkedJobService;

  /** Splits a PDF into overlapping chunks and queues them for analysis. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) {
    return ResponseEntity.accepted().body(UploadResponse.from(chunkedJobService.upload(file)));
  }

  /** Gets the status of a chunked job. */
  @GetMapping("/status/{jobId}")
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
    return ResponseEntity.ok(JobStatusResponse.from(chunkedJobService.getStatus(jobId)));
  }

  /** Gets the merged results of a finished chunked job. */
  @GetMapping("/result/{jobId}")
  public ResponseEntity<JobResultResponse> getResult(@PathVariable String jobId) {
    return ResponseEntity.ok(JobResultResponse.from(chunkedJobService.getResult(jobId)));
  }
}
