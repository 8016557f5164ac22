package com.flamingo.ai.summarizer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for summarizing already extracted text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummarizeTextRequest {

  @NotBlank(message = "Text is required")
  private String text;
}
