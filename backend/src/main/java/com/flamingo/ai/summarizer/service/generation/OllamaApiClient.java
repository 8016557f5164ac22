package com.flamingo.ai.summarizer.service.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.summarizer.config.SummarizerProperties;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * HTTP client for the Ollama REST API. Encapsulates all WebClient communication with the model
 * server; retry and failure classification live in {@link OllamaGenerationClient}.
 */
@Component
@Slf4j
public class OllamaApiClient {

  static final String GENERATE_PATH = "/api/generate";
  static final String TAGS_PATH = "/api/tags";

  private final WebClient webClient;
  private final String baseUrl;

  public OllamaApiClient(SummarizerProperties properties) {
    this.baseUrl = properties.getOllama().getBaseUrl();
    this.webClient =
        WebClient.builder()
            .baseUrl(baseUrl)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Ollama client initialized: baseUrl={}", baseUrl);
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Calls {@code /api/generate} and waits for the complete, non-streamed response.
   *
   * @param request the generation request
   * @param timeout upper bound for the whole exchange
   * @return the decoded response body
   */
  public GenerateResponse generate(GenerateRequest request, Duration timeout) {
    return webClient
        .post()
        .uri(GENERATE_PATH)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(GenerateResponse.class)
        .timeout(timeout)
        .block();
  }

  /**
   * Lists installed models via {@code /api/tags}.
   *
   * @throws org.springframework.web.reactive.function.client.WebClientResponseException on non-2xx
   */
  public TagsResponse tags(Duration timeout) {
    return webClient
        .get()
        .uri(TAGS_PATH)
        .retrieve()
        .bodyToMono(TagsResponse.class)
        .timeout(timeout)
        .block();
  }

  /** Returns the HTTP status of {@code /api/tags} without failing on non-2xx. */
  public int probeStatus(Duration timeout) {
    Integer status =
        webClient
            .get()
            .uri(TAGS_PATH)
            .exchangeToMono(
                response -> response.releaseBody().thenReturn(response.statusCode().value()))
            .timeout(timeout)
            .switchIfEmpty(Mono.just(-1))
            .block();
    return status == null ? -1 : status;
  }

  /** Body of {@code POST /api/generate}. {@code system} is omitted when null. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record GenerateRequest(
      String model, String prompt, boolean stream, Options options, String system) {}

  /** Sampling parameters sent with every generation request. */
  public record Options(
      double temperature,
      @JsonProperty("top_p") double topP,
      @JsonProperty("top_k") int topK,
      @JsonProperty("repeat_penalty") double repeatPenalty,
      @JsonProperty("num_predict") int numPredict) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record GenerateResponse(String response) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TagsResponse(List<ModelTag> models) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ModelTag(String name) {}
}
