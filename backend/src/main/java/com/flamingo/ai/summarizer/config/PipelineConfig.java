package com.flamingo.ai.summarizer.config;

import com.flamingo.ai.summarizer.service.chunking.TextChunker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the pipeline leaf components from {@link SummarizerProperties}. */
@Configuration
public class PipelineConfig {

  @Bean
  public TextChunker textChunker(SummarizerProperties properties) {
    SummarizerProperties.Chunking chunking = properties.getChunking();
    return new TextChunker(
        chunking.getWindowSize(), chunking.getOverlap(), chunking.getBoundarySearchChars());
  }
}
