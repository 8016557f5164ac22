package com.flamingo.ai.summarizer.service.chunking;

/**
 * A contiguous window of the source text.
 *
 * @param index zero-based position in document order
 * @param text the window content with surrounding whitespace trimmed
 * @param start offset of the untrimmed window in the source text (inclusive)
 * @param end offset of the untrimmed window in the source text (exclusive)
 */
public record TextChunk(int index, String text, int start, int end) {

  public int length() {
    return text.length();
  }
}
