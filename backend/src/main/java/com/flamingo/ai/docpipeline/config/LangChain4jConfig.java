package com.flamingo.ai.docpipeline.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Chat model for the OpenAI chunk analysis provider; only created when that provider is on. */
@Configuration
@ConditionalOnProperty(name = "pipeline.analysis.provider", havingValue = "openai")
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Bean
  public ChatModel chatModel(PipelineConfig pipelineConfig) {
    validateApiKey();
    PipelineConfig.Analysis analysis = pipelineConfig.getAnalysis();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(analysis.getModelName())
        .maxTokens(analysis.getMaxTokens())
        .temperature(analysis.getTemperature())
        .timeout(analysis.getTimeout())
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
