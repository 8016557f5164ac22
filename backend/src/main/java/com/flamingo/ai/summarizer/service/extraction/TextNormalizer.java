package com.flamingo.ai.summarizer.service.extraction;

import java.util.regex.Pattern;

/** Whitespace cleanup applied to extracted text before it is chunked. */
public final class TextNormalizer {

  private static final Pattern REPEATED_SPACES = Pattern.compile(" +");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n+");

  private TextNormalizer() {}

  /**
   * Collapses runs of spaces, reduces three or more line breaks to one blank line and trims.
   *
   * @param text raw extracted text, may be null
   * @return normalized text, never null
   */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
    normalized = REPEATED_SPACES.matcher(normalized).replaceAll(" ");
    normalized = EXCESS_BLANK_LINES.matcher(normalized).replaceAll("\n\n");
    return normalized.strip();
  }
}
