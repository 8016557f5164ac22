package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.summary.SummarizationStage;

/**
 * Base class for failures of one summarization stage. The cause is the {@link
 * GenerationFailedException} that ended the stage.
 */
public abstract class SummarizationStageException extends RuntimeException {

  private final SummarizationStage stage;

  protected SummarizationStageException(
      SummarizationStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public SummarizationStage getStage() {
    return stage;
  }

  /** Message of the innermost cause, for diagnostics returned to the caller. */
  public String getRootCauseMessage() {
    Throwable current = this;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage();
  }
}
