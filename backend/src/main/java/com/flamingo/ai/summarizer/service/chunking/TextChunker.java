package com.flamingo.ai.summarizer.service.chunking;

import com.flamingo.ai.summarizer.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits text into ordered, overlapping windows of at most {@code windowSize} characters.
 *
 * <p>A window that does not reach the end of the text is shortened to the last sentence or
 * paragraph break found in its final {@code boundarySearchChars} characters, so chunks tend to end
 * on natural breaks instead of mid-sentence. The next window starts {@code overlap} characters
 * before the previous one ended.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
@Slf4j
public class TextChunker {

  private static final String[] BOUNDARIES = {". ", "? ", "! ", "\n\n"};

  private final int windowSize;
  private final int overlap;
  private final int boundarySearchChars;

  public TextChunker(int windowSize, int overlap, int boundarySearchChars) {
    if (windowSize <= 0) {
      throw new InvalidConfigurationException("Window size must be positive, got " + windowSize);
    }
    if (overlap < 0) {
      throw new InvalidConfigurationException("Overlap must not be negative, got " + overlap);
    }
    if (overlap >= windowSize) {
      throw new InvalidConfigurationException(
          "Overlap (" + overlap + ") must be smaller than window size (" + windowSize + ")");
    }
    if (boundarySearchChars < 0) {
      throw new InvalidConfigurationException(
          "Boundary search range must not be negative, got " + boundarySearchChars);
    }
    this.windowSize = windowSize;
    this.overlap = overlap;
    this.boundarySearchChars = boundarySearchChars;
  }

  public TextChunker(int windowSize, int overlap) {
    this(windowSize, overlap, 200);
  }

  public int getWindowSize() {
    return windowSize;
  }

  public int getOverlap() {
    return overlap;
  }

  /**
   * Splits {@code text} into chunks.
   *
   * @param text the document text
   * @return chunks in document order; empty when the text is blank
   */
  public List<TextChunk> chunk(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    int length = text.length();
    if (length <= windowSize) {
      return List.of(new TextChunk(0, text.strip(), 0, length));
    }

    List<TextChunk> chunks = new ArrayList<>();
    int start = 0;
    while (start < length) {
      int end = start + windowSize;
      if (end < length) {
        end = keepSurrogatePair(text, start, naturalEnd(text, start, end));
      } else {
        end = length;
      }

      String content = text.substring(start, end).strip();
      if (!content.isEmpty()) {
        chunks.add(new TextChunk(chunks.size(), content, start, end));
      }

      start = end < length ? end - overlap : end;
      if (start < end && Character.isLowSurrogate(text.charAt(start))) {
        start++;
      }
    }

    log.debug(
        "Split {} chars into {} chunks (window={}, overlap={})",
        length,
        chunks.size(),
        windowSize,
        overlap);
    return chunks;
  }

  /** Describes how {@code text} would be chunked without keeping the chunks. */
  public ChunkInfo chunkInfo(String text) {
    List<TextChunk> chunks = chunk(text);
    double average =
        chunks.isEmpty() ? 0 : chunks.stream().mapToInt(TextChunk::length).average().orElse(0);
    return new ChunkInfo(
        text == null ? 0 : text.length(), chunks.size(), windowSize, overlap, average);
  }

  /** Moves a cut that falls inside a surrogate pair back before the pair, if that still advances. */
  private int keepSurrogatePair(String text, int start, int end) {
    if (Character.isHighSurrogate(text.charAt(end - 1)) && end - 1 - overlap > start) {
      return end - 1;
    }
    return end;
  }

  /**
   * Returns the end of the window {@code [start, hardEnd)} moved back to the latest boundary in its
   * search range, or {@code hardEnd} when there is none. A boundary is only taken when the next
   * window would still start after {@code start}.
   */
  private int naturalEnd(String text, int start, int hardEnd) {
    int searchFrom = Math.max(start, hardEnd - boundarySearchChars);
    int best = -1;
    for (String boundary : BOUNDARIES) {
      best = Math.max(best, lastIndexWithin(text, boundary, searchFrom, hardEnd));
    }
    if (best > start && best + 1 - overlap > start) {
      // keep the punctuation (or first newline) in this chunk
      return best + 1;
    }
    return hardEnd;
  }

  private static int lastIndexWithin(String text, String marker, int from, int to) {
    int index = text.lastIndexOf(marker, to - marker.length());
    return index >= from ? index : -1;
  }
}
