package com.flamingo.ai.summarizer.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  @DisplayName("should collapse repeated spaces")
  void shouldCollapseSpaces() {
    assertThat(TextNormalizer.normalize("a    b  c")).isEqualTo("a b c");
  }

  @Test
  @DisplayName("should reduce runs of blank lines to one blank line")
  void shouldReduceBlankLines() {
    assertThat(TextNormalizer.normalize("one\n\n\n\ntwo\n \n \nthree"))
        .isEqualTo("one\n\ntwo\n\nthree");
  }

  @Test
  @DisplayName("should keep a single paragraph break")
  void shouldKeepParagraphBreak() {
    assertThat(TextNormalizer.normalize("one\n\ntwo")).isEqualTo("one\n\ntwo");
  }

  @Test
  @DisplayName("should convert Windows line endings and trim")
  void shouldConvertLineEndings() {
    assertThat(TextNormalizer.normalize("  first\r\nsecond\r\n  ")).isEqualTo("first\nsecond");
  }

  @Test
  @DisplayName("should return empty string for null")
  void shouldHandleNull() {
    assertThat(TextNormalizer.normalize(null)).isEmpty();
  }
}
