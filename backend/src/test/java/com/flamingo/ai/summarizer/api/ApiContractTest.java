package com.flamingo.ai.summarizer.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.summarizer.api.dto.request.SummarizeTextRequest;
import com.flamingo.ai.summarizer.api.rest.HealthController;
import com.flamingo.ai.summarizer.api.rest.SummarizeController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public HTTP paths.
 *
 * <ul>
 *   <li>POST /summarize - Summarize an uploaded document
 *   <li>POST /summarize/text - Summarize JSON text
 *   <li>GET / - Service info
 *   <li>GET /health - Server and model endpoint status
 *   <li>GET /models - Installed models
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("SummarizeController API contract")
  class SummarizeControllerContract {

    @Test
    @DisplayName("should be mapped to /summarize")
    void shouldBeMappedToSummarize() {
      RequestMapping mapping = SummarizeController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/summarize");
    }

    @Test
    @DisplayName("should expose the text variant under /summarize/text")
    void shouldExposeTextEndpoint() throws NoSuchMethodException {
      PostMapping mapping =
          SummarizeController.class
              .getMethod("summarizeText", SummarizeTextRequest.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/text");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should serve /health and /models at the root")
    void shouldServeHealthAndModels() throws NoSuchMethodException {
      assertThat(HealthController.class.getAnnotation(RequestMapping.class)).isNull();
      assertThat(
              HealthController.class.getMethod("health").getAnnotation(GetMapping.class).value())
          .containsExactly("/health");
      assertThat(
              HealthController.class.getMethod("models").getAnnotation(GetMapping.class).value())
          .containsExactly("/models");
    }
  }
}
