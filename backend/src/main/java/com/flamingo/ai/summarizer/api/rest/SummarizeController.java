package com.flamingo.ai.summarizer.api.rest;

import com.flamingo.ai.summarizer.api.dto.request.SummarizeTextRequest;
import com.flamingo.ai.summarizer.api.dto.response.SummaryResponse;
import com.flamingo.ai.summarizer.exception.DocumentProcessingException;
import com.flamingo.ai.summarizer.service.extraction.TextExtractionService;
import com.flamingo.ai.summarizer.service.extraction.TextNormalizer;
import com.flamingo.ai.summarizer.service.extraction.UploadValidator;
import com.flamingo.ai.summarizer.service.generation.GenerationClient;
import com.flamingo.ai.summarizer.service.summary.SummarizerService;
import com.flamingo.ai.summarizer.service.summary.SummaryResult;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document summarization. */
@RestController
@RequestMapping("/summarize")
@RequiredArgsConstructor
@Slf4j
public class SummarizeController {

  private final UploadValidator uploadValidator;
  private final TextExtractionService textExtractionService;
  private final SummarizerService summarizerService;
  private final GenerationClient generationClient;

  /** Summarizes an uploaded PDF, DOCX, XLSX, XLS or TXT document. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<SummaryResponse> summarizeDocument(
      @RequestParam("file") MultipartFile file) {
    long started = System.nanoTime();
    String fileType = uploadValidator.validate(file);
    String fileName = file.getOriginalFilename();
    log.info("Processing file: {}", fileName);

    String text;
    try (InputStream inputStream = file.getInputStream()) {
      text = textExtractionService.extract(inputStream, fileName, fileType);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          fileName, "Failed to read upload: " + e.getMessage(), e);
    }
    uploadValidator.requireSufficientText(fileName, text);
    log.info("Extracted {} characters", text.length());

    SummaryResult result = summarizerService.summarize(text);
    SummaryResponse response =
        SummaryResponse.from(
            result, fileName, fileType, generationClient.getModel(), System.nanoTime() - started);
    log.info("Successfully processed {} in {}s", fileName, response.getProcessingTimeSec());
    return ResponseEntity.ok(response);
  }

  /** Summarizes text supplied directly in the request body. */
  @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<SummaryResponse> summarizeText(
      @Valid @RequestBody SummarizeTextRequest request) {
    long started = System.nanoTime();
    String text = TextNormalizer.normalize(request.getText());
    uploadValidator.requireSufficientText(null, text);

    SummaryResult result = summarizerService.summarize(text);
    return ResponseEntity.ok(
        SummaryResponse.from(
            result, null, "text", generationClient.getModel(), System.nanoTime() - started));
  }
}
