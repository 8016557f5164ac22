package com.flamingo.ai.summarizer.api.rest;

import com.flamingo.ai.summarizer.service.health.HealthService;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for service info, health checks and installed models. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  static final String SERVICE_NAME = "AI Summarization Server";
  static final String VERSION = "1.0.0";

  private final HealthService healthService;

  /** Returns service information and the endpoint map. */
  @GetMapping("/")
  public ResponseEntity<Map<String, Object>> root() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("service", SERVICE_NAME);
    info.put("status", "running");
    info.put("version", VERSION);
    info.put("model", healthService.configuredModel());
    info.put(
        "endpoints",
        Map.of(
            "summarize", "/summarize",
            "summarizeText", "/summarize/text",
            "health", "/health",
            "models", "/models"));
    return ResponseEntity.ok(info);
  }

  /** Returns server and model endpoint status. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("server", "healthy");
    health.put("ollama", healthService.isModelEndpointHealthy() ? "healthy" : "unhealthy");
    health.put("ollamaUrl", healthService.modelEndpointUrl());
    health.put("model", healthService.configuredModel());
    health.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(health);
  }

  /** Returns the models installed on the endpoint. */
  @GetMapping("/models")
  public ResponseEntity<Map<String, Object>> models() {
    List<String> models = healthService.installedModels();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("models", models);
    body.put("configured", healthService.configuredModel());
    body.put("installed", models.contains(healthService.configuredModel()));
    return ResponseEntity.ok(body);
  }
}
