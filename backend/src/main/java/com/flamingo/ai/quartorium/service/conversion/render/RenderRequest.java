package com.flamingo.ai.quartorium.service.conversion.render;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Input of a render.
 *
 * @param projectId id of the project the source belongs to
 * @param projectRoot project directory; copied into the render snapshot
 * @param sourcePath source file path relative to {@code projectRoot}
 * @param sourceText source to render, already stripped of its comments appendix
 * @param contentVersion version of the source; the SHA-256 of {@code sourceText} when blank
 */
public record RenderRequest(
    String projectId,
    Path projectRoot,
    String sourcePath,
    String sourceText,
    String contentVersion) {

  public RenderRequest {
    Objects.requireNonNull(projectId, "projectId must not be null");
    Objects.requireNonNull(projectRoot, "projectRoot must not be null");
    Objects.requireNonNull(sourcePath, "sourcePath must not be null");
    sourceText = sourceText == null ? "" : sourceText;
    if (contentVersion == null || contentVersion.isBlank()) {
      contentVersion = Hashing.sha256().hashString(sourceText, StandardCharsets.UTF_8).toString();
    }
  }

  public String documentId() {
    return projectId + "/" + sourcePath;
  }

  public RenderKey key() {
    return new RenderKey(documentId(), contentVersion);
  }
}
