package com.flamingo.ai.summarizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SummarizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SummarizerApplication.class, args);
  }
}
