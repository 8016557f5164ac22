package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.summary.SummarizationStage;

/** Exception thrown when the highlight list could not be generated. */
public class HighlightExtractionException extends SummarizationStageException {

  public HighlightExtractionException(Throwable cause) {
    super(
        SummarizationStage.EXTRACTING_HIGHLIGHTS,
        "Failed to extract highlights: " + cause.getMessage(),
        cause);
  }
}
