package com.flamingo.ai.summarizer.service.generation;

import com.flamingo.ai.summarizer.config.SummarizerProperties;
import com.flamingo.ai.summarizer.exception.GenerationFailedException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link GenerationClient} backed by Ollama's {@code /api/generate}.
 *
 * <p>Each call makes up to {@code maxRetries + 1} blocking attempts. Every attempt is reduced to an
 * {@link AttemptOutcome}; the loop stops on the first success or fatal outcome and otherwise waits
 * a {@link RetryBackoff} interval before trying again. A blank response counts as a retryable
 * failure and shares the same budget as network errors.
 */
@Service
@Slf4j
public class OllamaGenerationClient implements GenerationClient {

  private final OllamaApiClient apiClient;
  private final MeterRegistry meterRegistry;
  private final String model;
  private final int defaultMaxRetries;
  private final Duration timeout;
  private final Duration healthTimeout;
  private final OllamaApiClient.Options options;
  private final RetryBackoff backoff;

  public OllamaGenerationClient(
      OllamaApiClient apiClient, SummarizerProperties properties, MeterRegistry meterRegistry) {
    SummarizerProperties.Ollama ollama = properties.getOllama();
    SummarizerProperties.Sampling sampling = ollama.getSampling();
    this.apiClient = apiClient;
    this.meterRegistry = meterRegistry;
    this.model = ollama.getModel();
    this.defaultMaxRetries = ollama.getMaxRetries();
    this.timeout = Duration.ofSeconds(ollama.getTimeoutSeconds());
    this.healthTimeout = Duration.ofSeconds(ollama.getHealthTimeoutSeconds());
    this.options =
        new OllamaApiClient.Options(
            sampling.getTemperature(),
            sampling.getTopP(),
            sampling.getTopK(),
            sampling.getRepeatPenalty(),
            sampling.getNumPredict());
    this.backoff = new RetryBackoff(ollama.getBackoff());
  }

  @Override
  @Timed(value = "summarizer.generation", description = "Time for one generation call")
  public String generate(String prompt, String systemMessage) {
    return generate(prompt, systemMessage, defaultMaxRetries);
  }

  @Override
  @Timed(value = "summarizer.generation", description = "Time for one generation call")
  public String generate(String prompt, String systemMessage, int maxRetries) {
    Objects.requireNonNull(prompt, "prompt");
    OllamaApiClient.GenerateRequest request =
        new OllamaApiClient.GenerateRequest(
            model, prompt, false, options, blankToNull(systemMessage));

    int totalAttempts = Math.max(0, maxRetries) + 1;
    AttemptOutcome last = null;
    int attemptsMade = 0;
    while (attemptsMade < totalAttempts) {
      attemptsMade++;
      log.info("Calling Ollama API (attempt {}/{})", attemptsMade, totalAttempts);
      AttemptOutcome outcome = attempt(request);
      meterRegistry
          .counter("summarizer.generation.attempts", "outcome", outcome.status().name())
          .increment();

      if (outcome.isSuccess()) {
        log.info("Successfully generated {} characters", outcome.text().length());
        return outcome.text();
      }

      last = outcome;
      log.warn("{} (attempt {}, {})", outcome.error(), attemptsMade, outcome.status());
      if (!outcome.isRetryable()) {
        break;
      }
      if (attemptsMade < totalAttempts) {
        pause(backoff.delayAfter(attemptsMade), attemptsMade);
      }
    }

    throw new GenerationFailedException(last.kind(), attemptsMade, last.error());
  }

  /** Performs one request and classifies its result. Never throws. */
  AttemptOutcome attempt(OllamaApiClient.GenerateRequest request) {
    try {
      return AttemptClassifier.fromResponse(apiClient.generate(request, timeout));
    } catch (RuntimeException e) {
      return AttemptClassifier.fromError(e, timeout);
    }
  }

  @Override
  public boolean healthCheck() {
    try {
      int status = apiClient.probeStatus(healthTimeout);
      if (status != 200) {
        log.warn("Health check failed: Ollama answered HTTP {}", status);
      }
      return status == 200;
    } catch (RuntimeException e) {
      log.error("Health check failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public List<String> listModels() {
    try {
      OllamaApiClient.TagsResponse tags = apiClient.tags(healthTimeout);
      if (tags == null || tags.models() == null) {
        return List.of();
      }
      return tags.models().stream()
          .map(OllamaApiClient.ModelTag::name)
          .filter(Objects::nonNull)
          .toList();
    } catch (RuntimeException e) {
      log.error("Failed to list models: {}", e.getMessage());
      return List.of();
    }
  }

  @Override
  public String getModel() {
    return model;
  }

  /** Sleeps between attempts; overridable in tests. */
  protected void sleep(long delayMs) throws InterruptedException {
    Thread.sleep(delayMs);
  }

  private void pause(long delayMs, int attempt) {
    if (delayMs <= 0) {
      return;
    }
    log.debug("Waiting {} ms before retry after attempt {}", delayMs, attempt);
    try {
      sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationFailedException(
          GenerationFailureKind.INTERRUPTED, attempt, "Interrupted while waiting to retry");
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
