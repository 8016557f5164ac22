package com.flamingo.ai.summarizer.service.summary;

/**
 * Hierarchical summarization of arbitrarily long text.
 *
 * <p>The text is split into overlapping chunks, each chunk is summarized on its own, the chunk
 * summaries are merged into one detailed summary and a short highlight list is derived from it.
 */
public interface SummarizerService {

  /**
   * Summarizes already extracted and normalized text.
   *
   * @param text the document text
   * @return highlights and detailed summary
   * @throws com.flamingo.ai.summarizer.exception.EmptyInputException when the text has no content
   * @throws com.flamingo.ai.summarizer.exception.SummarizationStageException when a model call
   *     failed; the subclass names the stage
   */
  SummaryResult summarize(String text);
}
