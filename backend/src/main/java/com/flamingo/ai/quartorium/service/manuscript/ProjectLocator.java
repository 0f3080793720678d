package com.flamingo.ai.quartorium.service.manuscript;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import com.flamingo.ai.quartorium.exception.DocumentPathException;
import com.flamingo.ai.quartorium.exception.ProjectNotFoundException;
import com.flamingo.ai.quartorium.exception.SourceDocumentNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves project ids and document paths to files below the configured projects directory.
 *
 * <p>Nothing outside a project directory is ever resolved: absolute paths and paths that
 * normalize to a location outside the project are rejected.
 */
@Component
@Slf4j
public class ProjectLocator {

  private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

  private final Path baseDir;

  public ProjectLocator(QuartoriumConfig config) {
    this.baseDir = Path.of(config.getProjects().getBaseDir()).toAbsolutePath().normalize();
  }

  /**
   * Returns the directory of {@code projectId}.
   *
   * @throws DocumentPathException if the id is not a plain directory name
   * @throws ProjectNotFoundException if the directory does not exist
   */
  public Path projectRoot(String projectId) {
    if (projectId == null || !PROJECT_ID.matcher(projectId).matches()) {
      throw new DocumentPathException(projectId, "Invalid project id");
    }
    Path root = baseDir.resolve(projectId).normalize();
    if (!root.getParent().equals(baseDir) || !Files.isDirectory(root)) {
      throw new ProjectNotFoundException(projectId);
    }
    return root;
  }

  /**
   * Resolves a document path relative to its project.
   *
   * @throws DocumentPathException if the path is absolute or escapes the project
   * @throws SourceDocumentNotFoundException if no such file exists
   */
  public Path resolveDocument(String projectId, String documentPath) {
    Path root = projectRoot(projectId);
    if (documentPath == null || documentPath.isBlank()) {
      throw new DocumentPathException(documentPath, "Document path is required");
    }
    Path relative;
    try {
      relative = Path.of(documentPath);
    } catch (InvalidPathException e) {
      throw new DocumentPathException(documentPath, "Invalid document path");
    }
    if (relative.isAbsolute() || documentPath.startsWith("/")) {
      throw new DocumentPathException(documentPath, "Document path must be relative");
    }
    Path resolved = root.resolve(relative).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      log.warn("Rejected path {} outside project {}", documentPath, projectId);
      throw new DocumentPathException(documentPath, "Document path escapes the project");
    }
    if (!Files.isRegularFile(resolved)) {
      throw new SourceDocumentNotFoundException(projectId, documentPath);
    }
    return resolved;
  }

  /** Reads a source document as UTF-8. */
  public String readSource(String projectId, String documentPath) {
    Path file = resolveDocument(projectId, documentPath);
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SourceDocumentNotFoundException(projectId, documentPath, e);
    }
  }

  /** Returns the document path relative to the project root, with forward slashes. */
  public String relativePath(String projectId, String documentPath) {
    Path root = projectRoot(projectId);
    Path file = resolveDocument(projectId, documentPath);
    return root.relativize(file).toString().replace('\\', '/');
  }
}
