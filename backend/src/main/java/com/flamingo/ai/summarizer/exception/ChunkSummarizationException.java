package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.summary.SummarizationStage;

/** Exception thrown when one chunk could not be summarized. */
public class ChunkSummarizationException extends SummarizationStageException {

  private final int chunkIndex;

  public ChunkSummarizationException(int chunkIndex, Throwable cause) {
    super(
        SummarizationStage.SUMMARIZING_CHUNKS,
        "Failed to summarize chunk " + chunkIndex + ": " + cause.getMessage(),
        cause);
    this.chunkIndex = chunkIndex;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }
}
