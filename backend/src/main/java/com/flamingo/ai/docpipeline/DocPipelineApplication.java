package com.flamingo.ai.docpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** PDF chunking, OCR and job orchestration service. */
@SpringBootApplication
@EnableScheduling
public class DocPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocPipelineApplication.class, args);
  }
}
