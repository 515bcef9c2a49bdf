package com.flamingo.ai.ragpipeline.exception;

/**
 * Exception thrown when no embedding could be produced for a text.
 *
 * <p>Transient failures (model unreachable, rate limited) are retried; input problems such as an
 * oversized text are not.
 */
public class EmbeddingException extends RuntimeException {

  private final boolean transientFailure;
  private final String userMessage;

  public EmbeddingException(String message) {
    super(message);
    this.transientFailure = false;
    this.userMessage = "The text could not be embedded.";
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
    this.transientFailure = true;
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
