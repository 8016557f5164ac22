package com.flamingo.ai.summarizer.exception;

/** Exception thrown when an upload is rejected or its text cannot be extracted. */
public class DocumentProcessingException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public DocumentProcessingException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.userMessage = message;
  }

  public DocumentProcessingException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = message;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
