package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when chunks could not be written to or removed from the index. */
public class IndexingException extends RuntimeException {

  private final String userMessage;

  public IndexingException(String message) {
    super(message);
    this.userMessage = "Document index is temporarily unavailable. Please try again.";
  }

  public IndexingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Document index is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
