package com.flamingo.ai.summarizer.exception;

/** Exception thrown when the input text yields no chunk to summarize. */
public class EmptyInputException extends RuntimeException {

  public EmptyInputException(String message) {
    super(message);
  }
}
