package com.flamingo.ai.docpipeline.service.job;

/** Summary of an accepted chunked upload. */
public record UploadResult(String jobId, String fileName, int totalPages, int totalChunks) {}
