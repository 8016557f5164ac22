package com.flamingo.ai.summarizer.service.summary;

/** Stages of one summarization call, in execution order. */
public enum SummarizationStage {
  CHUNKING,
  SUMMARIZING_CHUNKS,
  MERGING,
  EXTRACTING_HIGHLIGHTS
}
