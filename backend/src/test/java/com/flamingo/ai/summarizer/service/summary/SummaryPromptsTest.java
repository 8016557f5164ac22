package com.flamingo.ai.summarizer.service.summary;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SummaryPrompts Tests")
class SummaryPromptsTest {

  @Test
  @DisplayName("should embed chunk text into the chunk prompt")
  void shouldEmbedChunkText() {
    String prompt = SummaryPrompts.chunk("Quarterly revenue rose.");

    assertThat(prompt)
        .contains("2-3 natural sentences, as if you're telling a colleague")
        .contains("Text:\nQuarterly revenue rose.\n")
        .endsWith("Your explanation:");
  }

  @Test
  @DisplayName("should number section summaries from one and separate them with blank lines")
  void shouldNumberSectionSummaries() {
    String prompt = SummaryPrompts.merge(List.of("First part.", "Second part.", "Third part."));

    assertThat(prompt)
        .contains("(2-4 sentences)")
        .contains("Section summaries:\n1. First part.\n\n2. Second part.\n\n3. Third part.\n");
  }

  @Test
  @DisplayName("should ask for dash-prefixed insights")
  void shouldAskForDashPrefixedInsights() {
    String prompt = SummaryPrompts.highlights("The detailed summary.");

    assertThat(prompt)
        .contains("3-5 key insights")
        .contains("starting with '-'")
        .contains("Summary:\nThe detailed summary.\n");
  }
}
