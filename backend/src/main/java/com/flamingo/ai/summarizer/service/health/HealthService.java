package com.flamingo.ai.summarizer.service.health;

import java.util.List;

/** Service interface for model endpoint health checks. */
public interface HealthService {

  /**
   * Probes the model endpoint.
   *
   * @return {@code true} if the endpoint answers its status probe with HTTP 200
   */
  boolean isModelEndpointHealthy();

  /** Installed model names, empty when the endpoint cannot be reached. */
  List<String> installedModels();

  /** Base URL of the model endpoint. */
  String modelEndpointUrl();

  /** Model used for summarization. */
  String configuredModel();
}
