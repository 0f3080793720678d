package com.flamingo.ai.quartorium.service.conversion.render;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Output of a successful render.
 *
 * @param key cache identity of the render
 * @param xml rendered JATS markup
 * @param snapshotDir isolated copy of the project the renderer ran in
 * @param outputDir directory the renderer wrote into
 * @param sourceDir directory of the rendered source file inside the snapshot
 * @param assetDir supporting files directory ({@code <name>_files}), or null when none was written
 */
public record RenderResult(
    RenderKey key, String xml, Path snapshotDir, Path outputDir, Path sourceDir, Path assetDir) {

  /**
   * Resolves an asset path as referenced from the rendered markup. Output files win over files
   * next to the source, which win over files at the project root; paths escaping the snapshot are
   * rejected.
   */
  public Optional<Path> resolveAsset(String relativePath) {
    if (relativePath == null || relativePath.isBlank()) {
      return Optional.empty();
    }
    String trimmed = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
    for (Path base : new Path[] {outputDir, sourceDir, snapshotDir}) {
      if (base == null) {
        continue;
      }
      Path candidate = base.resolve(trimmed).normalize();
      if (candidate.startsWith(snapshotDir.normalize()) && Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
