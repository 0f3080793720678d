package com.flamingo.ai.quartorium.service.manuscript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import com.flamingo.ai.quartorium.exception.DocumentPathException;
import com.flamingo.ai.quartorium.exception.ProjectNotFoundException;
import com.flamingo.ai.quartorium.exception.SourceDocumentNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectLocatorTest {

  @TempDir Path baseDir;

  private ProjectLocator locator;

  @BeforeEach
  void setUp() throws IOException {
    Path chapters = Files.createDirectories(baseDir.resolve("paper/chapters"));
    Files.writeString(chapters.resolve("intro.qmd"), "# Intro\n");
    Files.writeString(baseDir.resolve("secret.txt"), "do not serve");
    QuartoriumConfig config = new QuartoriumConfig();
    config.getProjects().setBaseDir(baseDir.toString());
    locator = new ProjectLocator(config);
  }

  @Test
  @DisplayName("should read a document inside the project")
  void shouldReadSource_whenPathInsideProject() {
    assertThat(locator.readSource("paper", "chapters/intro.qmd")).isEqualTo("# Intro\n");
    assertThat(locator.relativePath("paper", "./chapters/../chapters/intro.qmd"))
        .isEqualTo("chapters/intro.qmd");
  }

  @Test
  @DisplayName("should reject paths that leave the project")
  void shouldThrow_whenPathEscapesProject() {
    assertThatThrownBy(() -> locator.resolveDocument("paper", "../secret.txt"))
        .isInstanceOf(DocumentPathException.class)
        .hasMessageContaining("escapes");
    assertThatThrownBy(() -> locator.resolveDocument("paper", "/etc/passwd"))
        .isInstanceOf(DocumentPathException.class);
    assertThatThrownBy(() -> locator.resolveDocument("paper", " "))
        .isInstanceOf(DocumentPathException.class);
  }

  @Test
  @DisplayName("should reject project ids that are not plain directory names")
  void shouldThrow_whenProjectIdInvalid() {
    assertThatThrownBy(() -> locator.projectRoot("../paper"))
        .isInstanceOf(DocumentPathException.class);
    assertThatThrownBy(() -> locator.projectRoot("missing"))
        .isInstanceOf(ProjectNotFoundException.class);
  }

  @Test
  @DisplayName("should report a missing document")
  void shouldThrow_whenDocumentMissing() {
    assertThatThrownBy(() -> locator.readSource("paper", "chapters/outro.qmd"))
        .isInstanceOf(SourceDocumentNotFoundException.class);
    assertThatThrownBy(() -> locator.resolveDocument("paper", "chapters"))
        .isInstanceOf(SourceDocumentNotFoundException.class);
  }
}
