package com.flamingo.ai.summarizer.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the chunk summarization worker pool. */
@Configuration
public class AsyncConfig {

  @Bean(name = "chunkSummaryExecutor")
  public Executor chunkSummaryExecutor(SummarizerProperties properties) {
    SummarizerProperties.Concurrency concurrency = properties.getConcurrency();
    int workers = Math.max(1, concurrency.getChunkWorkers());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(concurrency.getQueueCapacity());
    executor.setThreadNamePrefix("chunk-sum-");
    // Saturated pool: the request thread summarizes the chunk itself.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
