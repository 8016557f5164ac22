package com.flamingo.ai.summarizer.service.generation;

/**
 * Result of one generation attempt. Exactly one of {@code text} (success) or {@code kind} and
 * {@code error} (failure) is set.
 */
public record AttemptOutcome(Status status, String text, GenerationFailureKind kind, String error) {

  /** What the retry loop should do with an attempt. */
  public enum Status {
    SUCCESS,
    RETRYABLE,
    FATAL
  }

  public static AttemptOutcome success(String text) {
    return new AttemptOutcome(Status.SUCCESS, text, null, null);
  }

  public static AttemptOutcome retryable(GenerationFailureKind kind, String error) {
    return new AttemptOutcome(Status.RETRYABLE, null, kind, error);
  }

  public static AttemptOutcome fatal(GenerationFailureKind kind, String error) {
    return new AttemptOutcome(Status.FATAL, null, kind, error);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public boolean isRetryable() {
    return status == Status.RETRYABLE;
  }
}
