package com.flamingo.ai.summarizer.service.health;

import com.flamingo.ai.summarizer.config.SummarizerProperties;
import com.flamingo.ai.summarizer.service.generation.GenerationClient;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Implementation of {@link HealthService} delegating to the {@link GenerationClient}. */
@Service
@RequiredArgsConstructor
public class HealthServiceImpl implements HealthService {

  private final GenerationClient generationClient;
  private final SummarizerProperties properties;

  @Override
  @Timed(value = "health.ollama", description = "Time to probe the model endpoint")
  public boolean isModelEndpointHealthy() {
    return generationClient.healthCheck();
  }

  @Override
  public List<String> installedModels() {
    return generationClient.listModels();
  }

  @Override
  public String modelEndpointUrl() {
    return properties.getOllama().getBaseUrl();
  }

  @Override
  public String configuredModel() {
    return generationClient.getModel();
  }
}
