package com.flamingo.ai.summarizer.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.summarizer.config.SummarizerProperties;
import com.flamingo.ai.summarizer.exception.DocumentProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

@DisplayName("UploadValidator Tests")
class UploadValidatorTest {

  private SummarizerProperties properties;
  private UploadValidator validator;

  @BeforeEach
  void setUp() {
    properties = new SummarizerProperties();
    validator = new UploadValidator(properties);
  }

  private static MockMultipartFile file(String name, byte[] content) {
    return new MockMultipartFile("file", name, "application/octet-stream", content);
  }

  @Test
  @DisplayName("should return the lower-case extension of an allowed file")
  void shouldReturnFileType() {
    assertThat(validator.validate(file("Report.PDF", new byte[10]))).isEqualTo("pdf");
    assertThat(validator.validate(file("sheet.xls", new byte[10]))).isEqualTo("xls");
  }

  @Test
  @DisplayName("should reject a missing filename")
  void shouldRejectMissingFilename() {
    assertThatThrownBy(() -> validator.validate(file("", new byte[10])))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("No filename provided");
  }

  @Test
  @DisplayName("should reject extensions outside the allowed list")
  void shouldRejectUnsupportedExtension() {
    assertThatThrownBy(() -> validator.validate(file("slides.pptx", new byte[10])))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("Unsupported file type. Allowed: pdf, docx, txt, xlsx, xls");
    assertThatThrownBy(() -> validator.validate(file("README", new byte[10])))
        .isInstanceOf(DocumentProcessingException.class);
  }

  @Test
  @DisplayName("should reject files over the size limit")
  void shouldRejectLargeFile() {
    properties.getUpload().setMaxFileSizeMb(1);

    assertThatThrownBy(() -> validator.validate(file("big.txt", new byte[1024 * 1024 + 1])))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("File too large. Maximum size: 1MB");
  }

  @Test
  @DisplayName("should require the minimum amount of text")
  void shouldRequireSufficientText() {
    assertThatThrownBy(() -> validator.requireSufficientText("a.txt", "too short"))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("Insufficient text content in document");
    assertThatThrownBy(() -> validator.requireSufficientText("a.txt", null))
        .isInstanceOf(DocumentProcessingException.class);

    String enough = "x".repeat(50);
    assertThatCode(() -> validator.requireSufficientText("a.txt", enough))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should derive extensions from the last dot")
  void shouldDeriveExtension() {
    assertThat(UploadValidator.fileExtension("archive.tar.TXT")).isEqualTo("txt");
    assertThat(UploadValidator.fileExtension("noext")).isEmpty();
    assertThat(UploadValidator.fileExtension("trailing.")).isEmpty();
  }
}
