package com.flamingo.ai.docpipeline.exception;

import com.flamingo.ai.docpipeline.domain.enums.JobStatus;

/** Exception thrown when a job result is requested while the job is still processing. */
public class JobNotReadyException extends RuntimeException {

  private final String jobId;
  private final JobStatus status;

  public JobNotReadyException(String jobId, JobStatus status) {
    super("Job " + jobId + " is not finished, status: " + status.getValue());
    this.jobId = jobId;
    this.status = status;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
