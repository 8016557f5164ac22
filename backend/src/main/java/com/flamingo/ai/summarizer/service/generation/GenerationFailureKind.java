package com.flamingo.ai.summarizer.service.generation;

/** Why a single generation attempt failed. */
public enum GenerationFailureKind {
  TIMEOUT,
  CONNECTION,
  HTTP_STATUS,
  EMPTY_RESPONSE,
  INVALID_RESPONSE,
  INTERRUPTED
}
