package com.flamingo.ai.summarizer.service.extraction;

import java.io.InputStream;

/**
 * Extracts plain text from an uploaded document.
 *
 * <p>Implementations must be stateless so one instance can serve concurrent requests.
 */
public interface TextExtractionService {

  /**
   * Extracts and normalizes the text of a document.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param inputStream raw document bytes
   * @param fileName original file name, used for messages
   * @param fileType lower-case extension without the dot (pdf, docx, txt, xlsx, xls)
   * @return normalized text
   * @throws com.flamingo.ai.summarizer.exception.DocumentProcessingException if no text can be
   *     extracted
   */
  String extract(InputStream inputStream, String fileName, String fileType);
}
