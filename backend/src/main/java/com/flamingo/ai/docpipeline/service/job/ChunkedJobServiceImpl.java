package com.flamingo.ai.docpipeline.service.job;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.JobSnapshot;
import com.flamingo.ai.docpipeline.service.chunking.PdfChunker;
import com.flamingo.ai.docpipeline.service.chunking.SplitDocument;
import com.flamingo.ai.docpipeline.service.document.PdfUploadValidator;
import com.flamingo.ai.docpipeline.service.storage.WorkspaceStorage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the ChunkedJobService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkedJobServiceImpl implements ChunkedJobService {

  private final PdfUploadValidator uploadValidator;
  private final PdfChunker pdfChunker;
  private final WorkspaceStorage workspaceStorage;
  private final JobOrchestrator jobOrchestrator;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "pipeline.upload", description = "Time to split and dispatch an upload")
  public UploadResult upload(MultipartFile file) {
    byte[] pdfBytes = uploadValidator.validateAndRead(file);
    String fileName = file.getOriginalFilename();
    String jobId = UUID.randomUUID().toString();

    Path workDir = workspaceStorage.createWorkDirectory(jobId);
    SplitDocument split;
    try {
      workspaceStorage.ensureSpace(
          workDir, pdfBytes.length, pipelineConfig.getChunking().getStorageReserveBytes());
      split = pdfChunker.split(pdfBytes, jobId, workDir);
    } catch (RuntimeException e) {
      workspaceStorage.release(workDir);
      meterRegistry.counter("pipeline_uploads_total", "outcome", "rejected").increment();
      throw e;
    }

    jobOrchestrator.createJob(jobId, fileName, split.totalPages(), split.chunks(), workDir);
    jobOrchestrator.submitAll(jobId);
    meterRegistry.counter("pipeline_uploads_total", "outcome", "accepted").increment();

    log.info(
        "Upload '{}' accepted as job {}: {} pages, {} chunks",
        fileName,
        jobId,
        split.totalPages(),
        split.chunks().size());
    return new UploadResult(jobId, fileName, split.totalPages(), split.chunks().size());
  }

  @Override
  public JobSnapshot getStatus(String jobId) {
    return jobOrchestrator.getStatus(jobId);
  }

  @Override
  public JobSnapshot getResult(String jobId) {
    return jobOrchestrator.getResult(jobId);
  }
}
