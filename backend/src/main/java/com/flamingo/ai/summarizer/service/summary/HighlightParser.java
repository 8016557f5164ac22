package com.flamingo.ai.summarizer.service.summary;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the model's highlight answer into a list of at most {@link #MAX_HIGHLIGHTS} strings.
 *
 * <p>Lines starting with {@code -}, {@code •} or {@code *} lose their marker; other non-blank lines
 * are taken verbatim so answers without bullets still yield highlights. Never fails: an empty or
 * unusable answer gives an empty list.
 */
public final class HighlightParser {

  public static final int MAX_HIGHLIGHTS = 5;

  private HighlightParser() {}

  public static List<String> parse(String response) {
    List<String> highlights = new ArrayList<>();
    if (response == null || response.isBlank()) {
      return highlights;
    }

    for (String rawLine : response.strip().split("\\R")) {
      if (highlights.size() >= MAX_HIGHLIGHTS) {
        break;
      }
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (isBulleted(line)) {
        String stripped = stripMarkers(line);
        if (!stripped.isEmpty()) {
          highlights.add(stripped);
        }
      } else {
        highlights.add(line);
      }
    }
    return highlights;
  }

  private static boolean isBulleted(String line) {
    return isMarker(line.charAt(0));
  }

  /** Drops any leading run of markers and spaces, so "- * item" and "--item" both give "item". */
  private static String stripMarkers(String line) {
    int i = 0;
    while (i < line.length() && (isMarker(line.charAt(i)) || line.charAt(i) == ' ')) {
      i++;
    }
    return line.substring(i).strip();
  }

  private static boolean isMarker(char c) {
    return c == '-' || c == '•' || c == '*';
  }
}
