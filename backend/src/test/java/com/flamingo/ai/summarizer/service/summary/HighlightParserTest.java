package com.flamingo.ai.summarizer.service.summary;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HighlightParser Tests")
class HighlightParserTest {

  @Test
  @DisplayName("should accept unmarked lines while under the limit and stop at five")
  void shouldMixMarkedAndUnmarkedLines_andStopAtFive() {
    List<String> highlights =
        HighlightParser.parse("- first\n- second\nthird\n- fourth\n- fifth\n- sixth");

    assertThat(highlights).containsExactly("first", "second", "third", "fourth", "fifth");
  }

  @Test
  @DisplayName("should strip all supported bullet markers")
  void shouldStripBulletMarkers() {
    List<String> highlights =
        HighlightParser.parse("• Revenue grew 12%\n* Costs were flat\n-   Margins improved  ");

    assertThat(highlights)
        .containsExactly("Revenue grew 12%", "Costs were flat", "Margins improved");
  }

  @Test
  @DisplayName("should strip stacked markers such as markdown bold prefixes")
  void shouldStripStackedMarkers() {
    assertThat(HighlightParser.parse("-- one\n** two\n- * three"))
        .containsExactly("one", "two", "three");
  }

  @Test
  @DisplayName("should skip blank lines and bare markers")
  void shouldSkipBlankLinesAndBareMarkers() {
    List<String> highlights = HighlightParser.parse("\n\n- alpha\n   \n-\n- beta\n\n");

    assertThat(highlights).containsExactly("alpha", "beta");
  }

  @Test
  @DisplayName("should keep numbered lines verbatim")
  void shouldKeepNumberedLinesVerbatim() {
    assertThat(HighlightParser.parse("1. Sales doubled\r\n2. Churn fell"))
        .containsExactly("1. Sales doubled", "2. Churn fell");
  }

  @Test
  @DisplayName("should return an empty list for empty or missing responses")
  void shouldReturnEmpty_whenNothingUsable() {
    assertThat(HighlightParser.parse(null)).isEmpty();
    assertThat(HighlightParser.parse("")).isEmpty();
    assertThat(HighlightParser.parse(" \n\t\n ")).isEmpty();
  }
}
