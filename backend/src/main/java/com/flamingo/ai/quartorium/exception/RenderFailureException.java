package com.flamingo.ai.quartorium.exception;

/**
 * Thrown when the external renderer fails or produces no output. Fatal for the document version
 * being rendered; callers must not retry automatically.
 */
public class RenderFailureException extends RuntimeException {

  private final String documentId;
  private final String diagnostics;

  public RenderFailureException(String documentId, String message, String diagnostics) {
    super(message);
    this.documentId = documentId;
    this.diagnostics = diagnostics;
  }

  public RenderFailureException(
      String documentId, String message, String diagnostics, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.diagnostics = diagnostics;
  }

  public String getDocumentId() {
    return documentId;
  }

  /** Renderer output (stderr and stdout) captured for the failed run. */
  public String getDiagnostics() {
    return diagnostics;
  }

  public String getUserMessage() {
    return "The document could not be rendered";
  }
}
