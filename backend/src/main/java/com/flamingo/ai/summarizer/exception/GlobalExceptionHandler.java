package com.flamingo.ai.summarizer.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Input problems map to 400, failures of the model endpoint to 502, everything else to 500.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidConfigurationException.class)
  public ResponseEntity<ApiError> handleInvalidConfiguration(
      InvalidConfigurationException ex, HttpServletRequest request) {
    incrementErrorCounter("invalid_configuration");
    String errorId = generateErrorId();
    log.warn("Invalid configuration [{}]: {}", errorId, ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_CONFIGURATION,
        ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(EmptyInputException.class)
  public ResponseEntity<ApiError> handleEmptyInput(
      EmptyInputException ex, HttpServletRequest request) {
    incrementErrorCounter("empty_input");
    String errorId = generateErrorId();
    log.warn("Empty input [{}]: {}", errorId, ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.EMPTY_INPUT, ex.getMessage(), null, request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {
    incrementErrorCounter("document_rejected");
    String errorId = generateErrorId();
    log.warn("Document rejected [{}]: file={}, {}", errorId, ex.getFileName(), ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.DOCUMENT_REJECTED,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    incrementErrorCounter("document_rejected");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.DOCUMENT_REJECTED,
        "File too large",
        null,
        request);
  }

  @ExceptionHandler(SummarizationStageException.class)
  public ResponseEntity<ApiError> handleSummarizationStage(
      SummarizationStageException ex, HttpServletRequest request) {
    incrementErrorCounter("summarization_" + ex.getStage().name().toLowerCase());
    String errorId = generateErrorId();
    log.error(
        "Summarization failed [{}] in stage {}: {}", errorId, ex.getStage(), ex.getMessage(), ex);

    String code =
        switch (ex.getStage()) {
          case MERGING -> ApiError.MERGE_FAILED;
          case EXTRACTING_HIGHLIGHTS -> ApiError.HIGHLIGHTS_FAILED;
          default -> ApiError.CHUNK_SUMMARY_FAILED;
        };
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            baseError(errorId, code, "Summarization failed: " + ex.getMessage(), request)
                .details(ex.getRootCauseMessage())
                .stage(ex.getStage().name())
                .build());
  }

  @ExceptionHandler(GenerationFailedException.class)
  public ResponseEntity<ApiError> handleGenerationFailed(
      GenerationFailedException ex, HttpServletRequest request) {
    incrementErrorCounter("llm_error");
    String errorId = generateErrorId();
    log.error(
        "LLM service error [{}] after {} attempt(s): {}",
        errorId,
        ex.getAttempts(),
        ex.getLastError(),
        ex);
    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        "AI service is temporarily unavailable. Please try again later.",
        ex.getLastError(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);
    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    HttpMessageNotReadableException.class,
    HttpMediaTypeNotSupportedException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message =
        ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(baseError(errorId, code, message, request).details(details).build());
  }

  private ApiError.ApiErrorBuilder baseError(
      String errorId, String code, String message, HttpServletRequest request) {
    return ApiError.builder()
        .errorId(errorId)
        .code(code)
        .message(message)
        .path(request.getRequestURI())
        .timestamp(Instant.now());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
