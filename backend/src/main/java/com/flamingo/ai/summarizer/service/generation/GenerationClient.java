package com.flamingo.ai.summarizer.service.generation;

import java.util.List;

/** Client for a generative text endpoint. */
public interface GenerationClient {

  /**
   * Generates text using the configured retry budget.
   *
   * @param prompt the prompt
   * @param systemMessage optional system instruction, may be null
   * @return non-blank generated text
   * @throws com.flamingo.ai.summarizer.exception.GenerationFailedException when every attempt
   *     failed
   */
  String generate(String prompt, String systemMessage);

  /**
   * Generates text, making at most {@code maxRetries + 1} attempts.
   *
   * @throws com.flamingo.ai.summarizer.exception.GenerationFailedException when every attempt
   *     failed or an attempt failed in a way a retry cannot fix
   */
  String generate(String prompt, String systemMessage, int maxRetries);

  /** Returns {@code true} when the endpoint answers its status probe with HTTP 200. */
  boolean healthCheck();

  /** Names of the installed models; empty when they cannot be listed. */
  List<String> listModels();

  /** Identity of the model used for generation. */
  String getModel();
}
