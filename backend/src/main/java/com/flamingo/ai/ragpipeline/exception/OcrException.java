package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when optical character recognition of a page image fails. */
public class OcrException extends RuntimeException {

  public OcrException(String message) {
    super(message);
  }

  public OcrException(String message, Throwable cause) {
    super(message, cause);
  }
}
