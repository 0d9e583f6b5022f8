package com.flamingo.ai.docpipeline.service.analysis;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.domain.model.Chunk;
import com.flamingo.ai.docpipeline.domain.model.ChunkAnalysis;
import com.flamingo.ai.docpipeline.domain.model.PageImage;
import com.flamingo.ai.docpipeline.exception.DownstreamUnavailableException;
import com.flamingo.ai.docpipeline.service.rasterize.PdfPageRenderer;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Analyzes chunks with an OpenAI vision model. Pages are rendered at low resolution and sent as
 * low-detail images with an extraction prompt.
 *
 * <p>The model reports no confidence of its own, so one is derived from the response: a truncated
 * answer scores 60, otherwise longer answers score higher (90 above 1000 characters, 80 above 500,
 * 70 below).
 */
@Service
@ConditionalOnProperty(name = "pipeline.analysis.provider", havingValue = "openai")
@Slf4j
public class OpenAiChunkAnalysisProvider implements ChunkAnalysisProvider {

  static final String NAME = "openai";

  static final String SYSTEM_PROMPT =
      """
      You extract the content of scanned document pages.
      Transcribe all text in reading order, preserving headings, lists and table rows.
      Do not summarize, translate or add commentary.
      """;

  private final ChatModel chatModel;
  private final PipelineConfig.Analysis settings;
  private final ProviderCounters counters;

  public OpenAiChunkAnalysisProvider(
      ChatModel chatModel, PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    this.chatModel = chatModel;
    this.settings = pipelineConfig.getAnalysis();
    this.counters = new ProviderCounters(NAME, meterRegistry);
  }

  @Override
  @Timed(value = "pipeline.analysis.openai", description = "Time to analyze a chunk with OpenAI")
  public ChunkAnalysis analyze(Chunk chunk, AnalysisContext context) {
    counters.request();
    List<ChatMessage> messages =
        List.of(SystemMessage.from(SYSTEM_PROMPT), userMessage(chunk, context));

    ChatResponse response;
    try {
      response = chatModel.chat(messages);
    } catch (RuntimeException e) {
      counters.failure();
      log.error(
          "OpenAI call failed for chunk {} of job {}: {}",
          chunk.id(),
          context.jobId(),
          e.getMessage());
      throw new DownstreamUnavailableException(NAME, "Chunk analysis call failed", e);
    }

    String content = response.aiMessage() != null ? response.aiMessage().text() : null;
    long tokensUsed = totalTokens(response.tokenUsage());
    double confidence = estimateConfidence(content, response.finishReason());
    counters.success(tokensUsed);

    log.info(
        "Chunk {} of job {} analyzed: {} chars, {} tokens, confidence {}",
        chunk.id(),
        context.jobId(),
        content == null ? 0 : content.length(),
        tokensUsed,
        confidence);
    return new ChunkAnalysis(content, confidence, settings.getModelName(), tokensUsed);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ProviderStats stats() {
    return counters.snapshot();
  }

  static double estimateConfidence(String content, FinishReason finishReason) {
    if (finishReason != null && finishReason != FinishReason.STOP) {
      return 60.0;
    }
    int length = content == null ? 0 : content.length();
    if (length > 1000) {
      return 90.0;
    }
    if (length > 500) {
      return 80.0;
    }
    return 70.0;
  }

  private UserMessage userMessage(Chunk chunk, AnalysisContext context) {
    List<Content> contents = new ArrayList<>();
    contents.add(
        TextContent.from(
            String.format(
                "Document '%s', pages %d-%d of %d. Extract the content of these pages.",
                context.fileName(), chunk.startPage(), chunk.endPage(), context.totalPages())));
    for (PageImage page : renderPages(chunk)) {
      contents.add(
          ImageContent.from(
              Base64.getEncoder().encodeToString(page.png()),
              "image/png",
              ImageContent.DetailLevel.LOW));
    }
    return UserMessage.from(contents);
  }

  private List<PageImage> renderPages(Chunk chunk) {
    try {
      byte[] bytes = Files.readAllBytes(chunk.file());
      try (PDDocument document = PdfPageRenderer.load(bytes, chunk.id())) {
        return PdfPageRenderer.render(
            document, 0, document.getNumberOfPages(), settings.getRenderDpi());
      }
    } catch (IOException e) {
      counters.failure();
      throw new UncheckedIOException("Cannot render chunk " + chunk.id(), e);
    }
  }

  private static long totalTokens(TokenUsage usage) {
    if (usage == null || usage.totalTokenCount() == null) {
      return 0;
    }
    return usage.totalTokenCount();
  }
}
