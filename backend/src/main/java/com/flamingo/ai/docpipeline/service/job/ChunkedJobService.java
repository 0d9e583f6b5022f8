package com.flamingo.ai.docpipeline.service.job;

import com.flamingo.ai.docpipeline.domain.model.JobSnapshot;
import org.springframework.web.multipart.MultipartFile;

/** Service for the chunked pipeline: upload, status and results. */
public interface ChunkedJobService {

  /** Splits an uploaded PDF into chunks and starts processing them. */
  UploadResult upload(MultipartFile file);

  JobSnapshot getStatus(String jobId);

  /** Results of a finished job, partial when the job ended in error. */
  JobSnapshot getResult(String jobId);
}
