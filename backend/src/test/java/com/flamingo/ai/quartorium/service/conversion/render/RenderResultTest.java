package com.flamingo.ai.quartorium.service.conversion.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RenderResultTest {

  @TempDir Path snapshot;

  private RenderResult result;

  @BeforeEach
  void setUp() throws IOException {
    Path outputDir = Files.createDirectories(snapshot.resolve("_rendered"));
    Path sourceDir = Files.createDirectories(snapshot.resolve("chapters"));
    Files.createDirectories(sourceDir.resolve("images"));
    Files.writeString(sourceDir.resolve("images/diagram.png"), "chapter");
    Files.createDirectories(snapshot.resolve("images"));
    Files.writeString(snapshot.resolve("images/diagram.png"), "root");
    Files.writeString(snapshot.resolve("images/logo.png"), "logo");
    Files.createDirectories(outputDir.resolve("intro_files"));
    Files.writeString(outputDir.resolve("intro_files/plot.png"), "plot");
    result =
        new RenderResult(
            new RenderKey("paper/chapters/intro.qmd", "v1"),
            "<article/>",
            snapshot,
            outputDir,
            sourceDir,
            outputDir.resolve("intro_files"));
  }

  @Test
  @DisplayName("should find a figure referenced relative to a source in a subdirectory")
  void shouldResolve_whenAssetNextToSource() {
    assertThat(result.resolveAsset("images/diagram.png"))
        .hasValueSatisfying(path -> assertThat(path).hasContent("chapter"));
  }

  @Test
  @DisplayName("should prefer render output and fall back to the project root")
  void shouldResolveInLookupOrder() {
    assertThat(result.resolveAsset("intro_files/plot.png"))
        .hasValueSatisfying(path -> assertThat(path).hasContent("plot"));
    assertThat(result.resolveAsset("/images/logo.png"))
        .hasValueSatisfying(path -> assertThat(path).hasContent("logo"));
  }

  @Test
  @DisplayName("should reject paths that leave the snapshot")
  void shouldReject_whenPathEscapesSnapshot() {
    assertThat(result.resolveAsset("../../../etc/passwd")).isEmpty();
    assertThat(result.resolveAsset(" ")).isEmpty();
  }
}
