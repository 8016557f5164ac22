package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.summary.SummarizationStage;

/** Exception thrown when chunk summaries could not be merged into one summary. */
public class MergeFailedException extends SummarizationStageException {

  public MergeFailedException(Throwable cause) {
    super(
        SummarizationStage.MERGING,
        "Failed to merge chunk summaries: " + cause.getMessage(),
        cause);
  }
}
