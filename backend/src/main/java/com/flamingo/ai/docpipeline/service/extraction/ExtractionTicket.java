package com.flamingo.ai.docpipeline.service.extraction;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on an accepted extraction.
 *
 * @param jobId id under which progress can be polled or streamed
 * @param result completes with the extraction or with its failure
 */
public record ExtractionTicket(String jobId, CompletableFuture<ExtractionResult> result) {}
