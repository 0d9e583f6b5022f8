package com.flamingo.ai.docpipeline.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the pipeline worker pools. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Fixed-size pool that runs OCR batches; sized by {@code pipeline.ocr.max-workers}. */
  @Bean(name = "ocrExecutor")
  public Executor ocrExecutor(PipelineConfig pipelineConfig) {
    PipelineConfig.Ocr ocr = pipelineConfig.getOcr();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ocr.getMaxWorkers());
    executor.setMaxPoolSize(ocr.getMaxWorkers());
    executor.setQueueCapacity(ocr.getQueueCapacity());
    executor.setThreadNamePrefix("ocr-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "extractionExecutor")
  public Executor extractionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "chunkProcessingExecutor")
  public Executor chunkProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("chunk-proc-");
    executor.initialize();
    return executor;
  }
}
