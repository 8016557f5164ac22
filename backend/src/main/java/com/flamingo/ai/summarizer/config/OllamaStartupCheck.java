package com.flamingo.ai.summarizer.config;

import com.flamingo.ai.summarizer.service.health.HealthService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Logs model endpoint connectivity once on startup.
 *
 * <p>An unreachable endpoint or a missing model is reported but does not stop the application:
 * the endpoint may come up later and each request retries on its own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OllamaStartupCheck implements CommandLineRunner {

  private final HealthService healthService;
  private final SummarizerProperties properties;

  @Override
  public void run(String... args) {
    String model = healthService.configuredModel();
    log.info("Ollama URL: {}", healthService.modelEndpointUrl());
    log.info("Model: {}", model);
    log.info("Max file size: {}MB", properties.getUpload().getMaxFileSizeMb());
    log.info(
        "Allowed extensions: {}", String.join(", ", properties.getUpload().getAllowedExtensions()));

    if (!healthService.isModelEndpointHealthy()) {
      log.error("Ollama service is not available at {}", healthService.modelEndpointUrl());
      log.error("Ensure Ollama is running and the model '{}' is installed", model);
      return;
    }
    log.info("Ollama service is healthy");

    List<String> models = healthService.installedModels();
    if (models.isEmpty()) {
      log.warn("No models found in Ollama");
      return;
    }
    log.info("Available models: {}", String.join(", ", models));
    if (!models.contains(model)) {
      log.warn("Configured model '{}' not found in available models", model);
    }
  }
}
