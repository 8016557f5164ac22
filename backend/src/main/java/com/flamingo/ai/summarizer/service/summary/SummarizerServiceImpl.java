package com.flamingo.ai.summarizer.service.summary;

import com.flamingo.ai.summarizer.exception.ChunkSummarizationException;
import com.flamingo.ai.summarizer.exception.EmptyInputException;
import com.flamingo.ai.summarizer.exception.GenerationFailedException;
import com.flamingo.ai.summarizer.exception.HighlightExtractionException;
import com.flamingo.ai.summarizer.exception.MergeFailedException;
import com.flamingo.ai.summarizer.service.chunking.TextChunk;
import com.flamingo.ai.summarizer.service.chunking.TextChunker;
import com.flamingo.ai.summarizer.service.generation.GenerationClient;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link SummarizerService} driving a {@link GenerationClient}.
 *
 * <p>Chunk summaries are requested on the bounded {@code chunkSummaryExecutor} and reassembled in
 * chunk order before merging. Any generation failure ends the call; no partial result is returned.
 */
@Service
@Slf4j
public class SummarizerServiceImpl implements SummarizerService {

  private final TextChunker chunker;
  private final GenerationClient generationClient;
  private final Executor chunkSummaryExecutor;

  public SummarizerServiceImpl(
      TextChunker chunker,
      GenerationClient generationClient,
      @Qualifier("chunkSummaryExecutor") Executor chunkSummaryExecutor) {
    this.chunker = chunker;
    this.generationClient = generationClient;
    this.chunkSummaryExecutor = chunkSummaryExecutor;
  }

  @Override
  @Timed(value = "summarizer.summarize", description = "Time for a full hierarchical summary")
  public SummaryResult summarize(String text) {
    log.info("Starting summarization for text of length {}", text == null ? 0 : text.length());

    List<TextChunk> chunks = chunker.chunk(text);
    if (chunks.isEmpty()) {
      log.warn("Stage {} produced no chunks", SummarizationStage.CHUNKING);
      throw new EmptyInputException("Text contains no content to summarize");
    }
    log.info("Text split into {} chunks", chunks.size());

    List<String> chunkSummaries = summarizeChunks(chunks);

    log.info("Combining chunk summaries");
    String detailedSummary = mergeSummaries(chunkSummaries);

    log.info("Extracting key points");
    List<String> highlights = extractHighlights(detailedSummary);

    log.info("Summarization complete: {} highlights", highlights.size());
    return new SummaryResult(highlights, detailedSummary, chunks.size());
  }

  /** Returns one summary per chunk, in chunk order. */
  List<String> summarizeChunks(List<TextChunk> chunks) {
    if (chunks.size() == 1) {
      return List.of(summarizeChunk(chunks.get(0), 1));
    }

    List<CompletableFuture<String>> pending = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      pending.add(
          CompletableFuture.supplyAsync(
              () -> summarizeChunk(chunk, chunks.size()), chunkSummaryExecutor));
    }

    List<String> summaries = new ArrayList<>(chunks.size());
    for (int i = 0; i < pending.size(); i++) {
      try {
        summaries.add(pending.get(i).join());
      } catch (CompletionException e) {
        pending.subList(i + 1, pending.size()).forEach(f -> f.cancel(false));
        throw unwrap(e);
      }
    }
    return summaries;
  }

  private String summarizeChunk(TextChunk chunk, int total) {
    log.info("Summarizing chunk {}/{}", chunk.index() + 1, total);
    try {
      return generationClient.generate(SummaryPrompts.chunk(chunk.text()), null);
    } catch (GenerationFailedException e) {
      throw new ChunkSummarizationException(chunk.index(), e);
    }
  }

  /** A single summary is already the combined summary; merging it again would add nothing. */
  String mergeSummaries(List<String> chunkSummaries) {
    if (chunkSummaries.size() == 1) {
      return chunkSummaries.get(0);
    }
    try {
      return generationClient.generate(
          SummaryPrompts.merge(chunkSummaries), SummaryPrompts.SYSTEM_MESSAGE);
    } catch (GenerationFailedException e) {
      throw new MergeFailedException(e);
    }
  }

  List<String> extractHighlights(String detailedSummary) {
    String response;
    try {
      response =
          generationClient.generate(
              SummaryPrompts.highlights(detailedSummary), SummaryPrompts.SYSTEM_MESSAGE);
    } catch (GenerationFailedException e) {
      throw new HighlightExtractionException(e);
    }
    return HighlightParser.parse(response);
  }

  private static RuntimeException unwrap(CompletionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof RuntimeException runtimeException) {
      return runtimeException;
    }
    return e;
  }
}
