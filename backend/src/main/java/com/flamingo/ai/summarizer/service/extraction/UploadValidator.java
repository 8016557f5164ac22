package com.flamingo.ai.summarizer.service.extraction;

import com.flamingo.ai.summarizer.config.SummarizerProperties;
import com.flamingo.ai.summarizer.exception.DocumentProcessingException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/** Checks uploads against the configured extension list and size limit. */
@Component
@RequiredArgsConstructor
public class UploadValidator {

  private final SummarizerProperties properties;

  /**
   * Validates the upload and returns its file type.
   *
   * @return lower-case extension without the dot
   * @throws DocumentProcessingException when the upload is rejected
   */
  public String validate(MultipartFile file) {
    SummarizerProperties.Upload upload = properties.getUpload();
    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isBlank()) {
      throw new DocumentProcessingException(fileName, "No filename provided");
    }

    String fileType = fileExtension(fileName);
    if (!upload.getAllowedExtensions().contains(fileType)) {
      throw new DocumentProcessingException(
          fileName,
          "Unsupported file type. Allowed: " + String.join(", ", upload.getAllowedExtensions()));
    }
    if (file.getSize() > upload.getMaxFileSizeBytes()) {
      throw new DocumentProcessingException(
          fileName, "File too large. Maximum size: " + upload.getMaxFileSizeMb() + "MB");
    }
    return fileType;
  }

  /** Requires at least the configured minimum of non-whitespace content. */
  public void requireSufficientText(String fileName, String text) {
    if (text == null || text.strip().length() < properties.getUpload().getMinTextLength()) {
      throw new DocumentProcessingException(fileName, "Insufficient text content in document");
    }
  }

  static String fileExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
