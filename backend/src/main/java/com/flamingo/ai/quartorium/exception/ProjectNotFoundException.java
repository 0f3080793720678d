package com.flamingo.ai.quartorium.exception;

/** Exception thrown when a project directory does not exist. */
public class ProjectNotFoundException extends RuntimeException {

  private final String projectId;

  public ProjectNotFoundException(String projectId) {
    super("Project not found: " + projectId);
    this.projectId = projectId;
  }

  public String getProjectId() {
    return projectId;
  }
}
