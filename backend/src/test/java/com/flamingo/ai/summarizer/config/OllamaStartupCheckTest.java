package com.flamingo.ai.summarizer.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.summarizer.service.health.HealthService;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OllamaStartupCheckTest {

  @Mock private HealthService healthService;

  @Test
  @DisplayName("should not list models when the endpoint is down")
  void shouldSkipModelListing_whenUnhealthy() {
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");
    when(healthService.modelEndpointUrl()).thenReturn("http://localhost:11434");
    when(healthService.isModelEndpointHealthy()).thenReturn(false);

    OllamaStartupCheck check = new OllamaStartupCheck(healthService, new SummarizerProperties());

    assertThatCode(() -> check.run()).doesNotThrowAnyException();
    verify(healthService, never()).installedModels();
  }

  @Test
  @DisplayName("should list models and keep running when the configured model is missing")
  void shouldCheckInstalledModels_whenHealthy() {
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");
    when(healthService.modelEndpointUrl()).thenReturn("http://localhost:11434");
    when(healthService.isModelEndpointHealthy()).thenReturn(true);
    when(healthService.installedModels()).thenReturn(List.of("llama3:8b"));

    OllamaStartupCheck check = new OllamaStartupCheck(healthService, new SummarizerProperties());

    assertThatCode(() -> check.run()).doesNotThrowAnyException();
    verify(healthService).installedModels();
  }
}
