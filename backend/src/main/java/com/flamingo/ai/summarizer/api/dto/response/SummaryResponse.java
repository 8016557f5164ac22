package com.flamingo.ai.summarizer.api.dto.response;

import com.flamingo.ai.summarizer.service.summary.SummaryResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a finished summarization. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {

  private String fileName;
  private String fileType;
  private List<String> summaryShort;
  private String summaryDetailed;
  private String model;
  private Integer chunkCount;
  private Double processingTimeSec;

  /** Creates a SummaryResponse from a pipeline result. */
  public static SummaryResponse from(
      SummaryResult result, String fileName, String fileType, String model, long elapsedNanos) {
    return SummaryResponse.builder()
        .fileName(fileName)
        .fileType(fileType)
        .summaryShort(result.highlights())
        .summaryDetailed(result.detailedSummary())
        .model(model)
        .chunkCount(result.chunkCount())
        .processingTimeSec(Math.round(elapsedNanos / 10_000_000.0) / 100.0)
        .build();
  }
}
