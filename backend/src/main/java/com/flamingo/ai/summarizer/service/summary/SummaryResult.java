package com.flamingo.ai.summarizer.service.summary;

import java.util.List;

/**
 * Outcome of a summarization call.
 *
 * @param highlights up to five short insights, in the order the model wrote them
 * @param detailedSummary the merged summary
 * @param chunkCount how many chunks the input was split into
 */
public record SummaryResult(List<String> highlights, String detailedSummary, int chunkCount) {

  public SummaryResult {
    highlights = highlights == null ? List.of() : List.copyOf(highlights);
  }
}
