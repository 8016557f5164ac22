package com.flamingo.ai.summarizer.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.summarizer.service.health.HealthService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private HealthService healthService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(healthService)).build();
  }

  @Test
  @DisplayName("should describe the service and its endpoints")
  void shouldReturnServiceInfo() throws Exception {
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");

    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.service").value("AI Summarization Server"))
        .andExpect(jsonPath("$.status").value("running"))
        .andExpect(jsonPath("$.model").value("gpt-oss:20b"))
        .andExpect(jsonPath("$.endpoints.summarize").value("/summarize"))
        .andExpect(jsonPath("$.endpoints.health").value("/health"));
  }

  @Test
  @DisplayName("should report an unreachable model endpoint as unhealthy")
  void shouldReportUnhealthyEndpoint() throws Exception {
    when(healthService.isModelEndpointHealthy()).thenReturn(false);
    when(healthService.modelEndpointUrl()).thenReturn("http://localhost:11434");
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.server").value("healthy"))
        .andExpect(jsonPath("$.ollama").value("unhealthy"))
        .andExpect(jsonPath("$.ollamaUrl").value("http://localhost:11434"))
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  @DisplayName("should report a reachable model endpoint as healthy")
  void shouldReportHealthyEndpoint() throws Exception {
    when(healthService.isModelEndpointHealthy()).thenReturn(true);
    when(healthService.modelEndpointUrl()).thenReturn("http://ollama:11434");
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");

    mockMvc.perform(get("/health")).andExpect(jsonPath("$.ollama").value("healthy"));
  }

  @Test
  @DisplayName("should list installed models and flag the configured one")
  void shouldListModels() throws Exception {
    when(healthService.installedModels()).thenReturn(List.of("llama3:8b", "gpt-oss:20b"));
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");

    mockMvc
        .perform(get("/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.models.length()").value(2))
        .andExpect(jsonPath("$.configured").value("gpt-oss:20b"))
        .andExpect(jsonPath("$.installed").value(true));
  }

  @Test
  @DisplayName("should flag a configured model that is not installed")
  void shouldFlagMissingModel() throws Exception {
    when(healthService.installedModels()).thenReturn(List.of());
    when(healthService.configuredModel()).thenReturn("gpt-oss:20b");

    mockMvc.perform(get("/models")).andExpect(jsonPath("$.installed").value(false));
  }
}
