package com.flamingo.ai.quartorium.exception;

/** Exception thrown when a requested path escapes its project or is otherwise unusable. */
public class DocumentPathException extends RuntimeException {

  private final String path;

  public DocumentPathException(String path, String message) {
    super(message);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
