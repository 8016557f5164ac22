package com.flamingo.ai.summarizer.service.extraction;

import com.flamingo.ai.summarizer.exception.DocumentProcessingException;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;

/**
 * {@link TextExtractionService} for the supported upload formats.
 *
 * <ul>
 *   <li>{@code pdf} → PDFBox {@link PDFTextStripper}, page by page
 *   <li>{@code docx}, {@code xlsx}, {@code xls}, {@code txt} → Apache Tika {@link
 *       AutoDetectParser}; spreadsheets come out sheet by sheet with tab-separated cells
 * </ul>
 */
@Service
@Slf4j
public class TikaTextExtractionService implements TextExtractionService {

  /** Loads Tika's parser registry once; the parser is safe for concurrent use. */
  private final AutoDetectParser parser = new AutoDetectParser();

  @Override
  public String extract(InputStream inputStream, String fileName, String fileType) {
    String raw =
        switch (fileType) {
          case "pdf" -> extractPdf(inputStream, fileName);
          case "docx", "xlsx", "xls", "txt" -> extractWithTika(inputStream, fileName);
          default -> throw new DocumentProcessingException(
              fileName, "Unsupported file type: " + fileType);
        };

    String text = TextNormalizer.normalize(raw);
    if (text.isEmpty()) {
      throw new DocumentProcessingException(
          fileName, "No text could be extracted from " + fileType.toUpperCase());
    }
    log.debug("Extracted {} chars from '{}' ({})", text.length(), fileName, fileType);
    return text;
  }

  private String extractPdf(InputStream inputStream, String fileName) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument document = Loader.loadPDF(bytes)) {
        PDFTextStripper stripper = new PDFTextStripper();
        StringBuilder text = new StringBuilder();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
          stripper.setStartPage(page);
          stripper.setEndPage(page);
          String pageText = stripper.getText(document);
          if (!pageText.isBlank()) {
            if (text.length() > 0) {
              text.append('\n');
            }
            text.append(pageText);
          }
        }
        return text.toString();
      }
    } catch (IOException e) {
      log.error("PDFBox extraction failed for '{}': {}", fileName, e.getMessage());
      throw new DocumentProcessingException(
          fileName, "Failed to extract text from PDF: " + e.getMessage(), e);
    }
  }

  private String extractWithTika(InputStream inputStream, String fileName) {
    try {
      BodyContentHandler handler = new BodyContentHandler(-1);
      Metadata metadata = new Metadata();
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
      parser.parse(inputStream, handler, metadata, new ParseContext());
      return handler.toString();
    } catch (Exception e) {
      log.error("Tika extraction failed for '{}': {}", fileName, e.getMessage());
      throw new DocumentProcessingException(
          fileName, "Text extraction failed: " + e.getMessage(), e);
    }
  }
}
