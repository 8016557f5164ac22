package com.flamingo.ai.summarizer.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the summarization pipeline. */
@Configuration
@ConfigurationProperties(prefix = "summarizer")
@Getter
@Setter
public class SummarizerProperties {

  private Chunking chunking = new Chunking();
  private Ollama ollama = new Ollama();
  private Concurrency concurrency = new Concurrency();
  private Upload upload = new Upload();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum characters per chunk before boundary-aware trimming. */
    private int windowSize = 3000;

    private int overlap = 300;

    /** How far back from the window end to look for a sentence or paragraph break. */
    private int boundarySearchChars = 200;
  }

  @Getter
  @Setter
  public static class Ollama {
    private String baseUrl = "http://localhost:11434";
    private String model = "gpt-oss:20b";
    private int timeoutSeconds = 120;
    private int healthTimeoutSeconds = 5;

    /** Extra attempts after the first one; a call makes at most maxRetries + 1 requests. */
    private int maxRetries = 1;

    private Sampling sampling = new Sampling();
    private Backoff backoff = new Backoff();
  }

  @Getter
  @Setter
  public static class Sampling {
    private double temperature = 0.7;
    private double topP = 0.9;
    private int topK = 40;
    private double repeatPenalty = 1.1;
    private int numPredict = 512;
  }

  /** Delay between retryable generation attempts. */
  @Getter
  @Setter
  public static class Backoff {
    /** First delay in milliseconds; 0 retries immediately. */
    private long initialIntervalMs = 500;

    private double multiplier = 2.0;
    private double randomizationFactor = 0.5;
  }

  @Getter
  @Setter
  public static class Concurrency {
    /** Upper bound on chunk summaries in flight against the model endpoint. */
    private int chunkWorkers = 2;

    private int queueCapacity = 500;
  }

  @Getter
  @Setter
  public static class Upload {
    private int maxFileSizeMb = 20;
    private List<String> allowedExtensions =
        new ArrayList<>(List.of("pdf", "docx", "txt", "xlsx", "xls"));
    private int minTextLength = 50;

    public long getMaxFileSizeBytes() {
      return maxFileSizeMb * 1024L * 1024L;
    }
  }
}
