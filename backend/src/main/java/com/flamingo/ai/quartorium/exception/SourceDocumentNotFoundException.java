package com.flamingo.ai.quartorium.exception;

/** Exception thrown when a source document is missing from its project. */
public class SourceDocumentNotFoundException extends RuntimeException {

  private final String projectId;
  private final String path;

  public SourceDocumentNotFoundException(String projectId, String path) {
    super(String.format("Document %s not found in project %s", path, projectId));
    this.projectId = projectId;
    this.path = path;
  }

  public SourceDocumentNotFoundException(String projectId, String path, Throwable cause) {
    super(String.format("Document %s could not be read in project %s", path, projectId), cause);
    this.projectId = projectId;
    this.path = path;
  }

  public String getProjectId() {
    return projectId;
  }

  public String getPath() {
    return path;
  }
}
