package com.flamingo.ai.summarizer.service.generation;

import com.flamingo.ai.summarizer.config.SummarizerProperties;
import io.github.resilience4j.core.IntervalFunction;

/** Exponential, jittered delay between retryable generation attempts. */
class RetryBackoff {

  private final IntervalFunction intervalFunction;

  RetryBackoff(SummarizerProperties.Backoff backoff) {
    this.intervalFunction =
        backoff.getInitialIntervalMs() > 0
            ? IntervalFunction.ofExponentialRandomBackoff(
                backoff.getInitialIntervalMs(),
                backoff.getMultiplier(),
                backoff.getRandomizationFactor())
            : null;
  }

  /**
   * Delay to wait after the given failed attempt.
   *
   * @param failedAttempt one-based number of the attempt that just failed
   * @return delay in milliseconds, 0 when backoff is disabled
   */
  long delayAfter(int failedAttempt) {
    return intervalFunction == null ? 0 : intervalFunction.apply(failedAttempt);
  }
}
