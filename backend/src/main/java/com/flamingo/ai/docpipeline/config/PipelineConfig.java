package com.flamingo.ai.docpipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the document pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Validated
@Getter
@Setter
public class PipelineConfig {

  @Valid private Ocr ocr = new Ocr();
  @Valid private Rasterizer rasterizer = new Rasterizer();
  @Valid private Chunking chunking = new Chunking();
  @Valid private Upload upload = new Upload();
  @Valid private Storage storage = new Storage();
  @Valid private Analysis analysis = new Analysis();
  private Map<String, @Valid Breaker> breakers = new LinkedHashMap<>();
  @Valid private Progress progress = new Progress();
  @Valid private Jobs jobs = new Jobs();

  /** Returns the breaker settings for a call-site, falling back to defaults. */
  public Breaker breaker(String name) {
    return breakers.getOrDefault(name, new Breaker());
  }

  @Getter
  @Setter
  public static class Ocr {
    @Min(1)
    private int maxWorkers = Math.min(32, Runtime.getRuntime().availableProcessors() + 4);

    /** Pages per progress batch. Zero means one batch per worker slot. */
    @Min(0)
    private int batchSize = 0;

    /** Pages waiting for a worker across all documents. */
    @Min(1)
    private int queueCapacity = 10_000;

    /**
     * Default rasterization resolution. Higher values improve OCR accuracy at the cost of
     * processing time and memory.
     */
    @Min(1)
    private int defaultDpi = 200;

    private String tesseractCommand = "tesseract";
    private String language = "eng";
    private int engineMode = 1;
    private int pageSegmentationMode = 3;
    private Duration pageTimeout = Duration.ofSeconds(60);

    public int effectiveBatchSize() {
      return batchSize > 0 ? batchSize : maxWorkers;
    }
  }

  @Getter
  @Setter
  public static class Rasterizer {
    /** Rendering engine: pdfbox (in-process) or pdftoppm (poppler CLI). */
    private String engine = "pdfbox";

    private String pdftoppmCommand = "pdftoppm";
    private String pdfinfoCommand = "pdfinfo";
    private Duration toolTimeout = Duration.ofMinutes(5);
    private Duration probePageTimeout = Duration.ofSeconds(5);
    @Min(1)
    private int probeMaxPages = 5000;
    @Min(1)
    private int maxDpi = 600;
  }

  @Getter
  @Setter
  public static class Chunking {
    @Min(1)
    private int chunkSize = 20;
    @Min(0)
    private int overlap = 2;
    @Min(1)
    private long maxChunkBytes = 50L * 1024 * 1024;

    /** Free space that must remain on the work volume after each chunk is written. */
    @Min(0)
    private long storageReserveBytes = 100L * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Upload {
    @Min(1)
    private long maxFileBytes = 100L * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Storage {
    private String workDir = System.getProperty("java.io.tmpdir") + "/docpipeline";
  }

  @Getter
  @Setter
  public static class Analysis {
    /** Chunk analysis provider: ocr or openai. */
    private String provider = "ocr";

    /** Minimum confidence (0-100) for a chunk result to be accepted. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double confidenceThreshold = 60.0;

    private String modelName = "gpt-4o-mini";
    private int maxTokens = 2048;
    private double temperature = 0.2;
    private Duration timeout = Duration.ofSeconds(60);
    private int renderDpi = 72;
  }

  @Getter
  @Setter
  public static class Breaker {
    @Min(1)
    private int failureThreshold = 5;
    private Duration resetTimeout = Duration.ofSeconds(60);
    private Duration halfOpenTimeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Progress {
    private Duration streamPollInterval = Duration.ofMillis(200);
    private Duration streamTimeout = Duration.ofMinutes(30);

    /** Age after which a progress record nobody reads any more is reclaimed. */
    private Duration retention = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Jobs {
    private Duration retention = Duration.ofHours(1);
    private Duration evictionInterval = Duration.ofSeconds(60);
  }
}
