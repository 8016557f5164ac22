package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.generation.GenerationFailureKind;

/** Exception thrown when the generation endpoint did not produce text within the retry budget. */
public class GenerationFailedException extends RuntimeException {

  private final GenerationFailureKind kind;
  private final int attempts;
  private final String lastError;

  public GenerationFailedException(GenerationFailureKind kind, int attempts, String lastError) {
    super("Failed to generate text after " + attempts + " attempt(s): " + lastError);
    this.kind = kind;
    this.attempts = attempts;
    this.lastError = lastError;
  }

  /** Classification of the most recent failed attempt. */
  public GenerationFailureKind getKind() {
    return kind;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getLastError() {
    return lastError;
  }
}
