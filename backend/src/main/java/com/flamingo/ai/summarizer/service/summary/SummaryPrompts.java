package com.flamingo.ai.summarizer.service.summary;

import dev.langchain4j.model.input.PromptTemplate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Prompt templates for the three model calls of a summarization. */
final class SummaryPrompts {

  static final String SYSTEM_MESSAGE =
      "You are a helpful AI assistant. Your goal is to provide concise and accurate information.";

  private static final PromptTemplate CHUNK_TEMPLATE =
      PromptTemplate.from(
          """
          Read this text and explain what it's about in 2-3 natural sentences, as if you're \
          telling a colleague.

          Write in a conversational, human way. Focus on the main points and what stands out. \
          Be brief but clear.

          Text:
          {{text}}

          Your explanation:""");

  private static final PromptTemplate MERGE_TEMPLATE =
      PromptTemplate.from(
          """
          You are an expert at explaining data and documents in natural, conversational language.

          Below are summaries of different sections. Write a brief, flowing paragraph \
          (2-4 sentences) that explains what this document is about - as if you're telling a \
          colleague in person.

          Write naturally, like a human would speak. Focus on the main story, key patterns, and \
          what stands out. Be concise and engaging.

          Section summaries:
          {{summaries}}

          Your natural summary (2-4 sentences):""");

  private static final PromptTemplate HIGHLIGHTS_TEMPLATE =
      PromptTemplate.from(
          """
          Based on this summary, write 3-5 key insights as short, natural sentences. Each insight \
          should be specific and highlight what matters most.

          Write as if you're explaining the highlights to someone. Be concise and direct. Write \
          each insight on a new line starting with '-'.

          Summary:
          {{summary}}

          Key insights:
          """);

  private SummaryPrompts() {}

  static String chunk(String text) {
    return CHUNK_TEMPLATE.apply(Map.of("text", text)).text();
  }

  /** Numbers the summaries from 1 and joins them with blank lines. */
  static String merge(List<String> chunkSummaries) {
    String numbered =
        IntStream.range(0, chunkSummaries.size())
            .mapToObj(i -> (i + 1) + ". " + chunkSummaries.get(i))
            .collect(Collectors.joining("\n\n"));
    return MERGE_TEMPLATE.apply(Map.of("summaries", numbered)).text();
  }

  static String highlights(String summary) {
    return HIGHLIGHTS_TEMPLATE.apply(Map.of("summary", summary)).text();
  }
}
