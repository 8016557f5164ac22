package com.flamingo.ai.summarizer.service.generation;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * Maps the raw result of a call to the generation endpoint onto an {@link AttemptOutcome}.
 *
 * <p>Timeouts, connection errors, 5xx, 408, 429, blank and unreadable responses are retryable. Any
 * other 4xx is fatal: a malformed request or an unknown model will not succeed on retry.
 */
final class AttemptClassifier {

  private AttemptClassifier() {}

  static AttemptOutcome fromResponse(OllamaApiClient.GenerateResponse response) {
    String text =
        response == null || response.response() == null ? "" : response.response().strip();
    if (text.isEmpty()) {
      return AttemptOutcome.retryable(
          GenerationFailureKind.EMPTY_RESPONSE, "Empty response from Ollama");
    }
    return AttemptOutcome.success(text);
  }

  static AttemptOutcome fromError(Throwable error, Duration timeout) {
    Throwable cause = Exceptions.unwrap(error);

    if (isTimeout(cause)) {
      return AttemptOutcome.retryable(
          GenerationFailureKind.TIMEOUT, "Request timeout after " + timeout.toSeconds() + "s");
    }
    if (cause instanceof WebClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      String message = "HTTP error: " + status;
      if (status >= 400 && status < 500 && status != 408 && status != 429) {
        return AttemptOutcome.fatal(GenerationFailureKind.HTTP_STATUS, message);
      }
      return AttemptOutcome.retryable(GenerationFailureKind.HTTP_STATUS, message);
    }
    if (cause instanceof WebClientRequestException) {
      return AttemptOutcome.retryable(
          GenerationFailureKind.CONNECTION, "Connection error: " + cause.getMessage());
    }
    return AttemptOutcome.retryable(
        GenerationFailureKind.INVALID_RESPONSE, String.valueOf(cause.getMessage()));
  }

  private static boolean isTimeout(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }
}
