package com.flamingo.ai.summarizer.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String INVALID_CONFIGURATION = "CONFIG_001";
  public static final String EMPTY_INPUT = "INPUT_001";
  public static final String DOCUMENT_REJECTED = "DOCUMENT_001";
  public static final String CHUNK_SUMMARY_FAILED = "SUMMARY_001";
  public static final String MERGE_FAILED = "SUMMARY_002";
  public static final String HIGHLIGHTS_FAILED = "SUMMARY_003";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Innermost cause message, for upstream failures. */
  private final String details;

  /** Pipeline stage that failed, set only for summarization failures. */
  private final String stage;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
