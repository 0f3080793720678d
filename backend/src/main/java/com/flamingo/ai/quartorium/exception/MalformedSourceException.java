package com.flamingo.ai.quartorium.exception;

/** Exception thrown when rendered XML cannot be parsed or lacks an article body. */
public class MalformedSourceException extends RuntimeException {

  public MalformedSourceException(String message) {
    super(message);
  }

  public MalformedSourceException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "The rendered document is malformed and cannot be opened in the editor";
  }
}
