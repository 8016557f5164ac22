package com.flamingo.ai.summarizer.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics setup: {@code @Timed} support plus tags shared by every summarizer meter. */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags each meter with the configured model so latency can be compared across models. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> summarizerCommonTags(
      SummarizerProperties properties) {
    return registry ->
        registry
            .config()
            .commonTags("application", "summarizer", "model", properties.getOllama().getModel());
  }
}
