package com.flamingo.ai.summarizer.exception;

/** Exception thrown when a pipeline component is built with settings it cannot run with. */
public class InvalidConfigurationException extends RuntimeException {

  public InvalidConfigurationException(String message) {
    super(message);
  }
}
