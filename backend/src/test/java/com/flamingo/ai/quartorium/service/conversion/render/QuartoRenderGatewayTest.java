package com.flamingo.ai.quartorium.service.conversion.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import com.flamingo.ai.quartorium.exception.RenderFailureException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class QuartoRenderGatewayTest {

  private static final String JATS = "<article><body><p>Hi</p></body></article>";

  @TempDir Path projectRoot;
  @TempDir Path workDir;

  private QuartoriumConfig config;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() throws IOException {
    config = new QuartoriumConfig();
    config.getRender().setWorkDir(workDir.toString());
    config.getRender().setTimeoutSeconds(10);
    meterRegistry = new SimpleMeterRegistry();
    Files.writeString(projectRoot.resolve("doc.qmd"), "# Stale copy\n");
    Files.writeString(projectRoot.resolve("references.bib"), "@book{x, title={X}}\n");
  }

  private QuartoRenderGateway gatewayRunning(String script) {
    config.getRender().setExecutable("sh");
    config.getRender().setArguments(List.of("-c", script, "{source}"));
    return new QuartoRenderGateway(config, meterRegistry);
  }

  private RenderRequest request(String version) {
    return new RenderRequest("proj", projectRoot, "doc.qmd", "# Fresh\n", version);
  }

  @Test
  @DisplayName("should substitute source and output placeholders in the command")
  void shouldBuildCommand_whenPlaceholdersConfigured() {
    QuartoRenderGateway gateway = new QuartoRenderGateway(config, meterRegistry);
    Path source = workDir.resolve("snap/doc.qmd");
    Path output = workDir.resolve("snap/_rendered");

    List<String> command = gateway.buildCommand(source, output);

    assertThat(command)
        .containsExactly(
            "quarto",
            "render",
            "doc.qmd",
            "--to",
            "jats",
            "--output-dir",
            output.toAbsolutePath().toString());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("should render in a snapshot holding the fresh source and cache the result")
  void shouldRenderAndCache_whenRendererSucceeds() throws IOException {
    QuartoRenderGateway gateway =
        gatewayRunning(
            "cp \"$0\" '{outputDir}/source-seen.txt' && mkdir -p '{outputDir}/doc_files' "
                + "&& printf 'png' > '{outputDir}/doc_files/plot.png' "
                + "&& printf '"
                + JATS
                + "' > '{outputDir}/doc.xml'");

    RenderResult first = gateway.render(request("v1"));
    RenderResult second = gateway.render(request("v1"));

    assertThat(first.xml()).isEqualTo(JATS);
    assertThat(second).isSameAs(first);
    assertThat(first.snapshotDir()).startsWith(workDir);
    assertThat(first.assetDir()).isNotNull();
    assertThat(Files.readString(first.outputDir().resolve("source-seen.txt")))
        .isEqualTo("# Fresh\n");
    assertThat(first.snapshotDir().resolve("references.bib")).exists();
    assertThat(first.resolveAsset("doc_files/plot.png")).isPresent();
    assertThat(first.resolveAsset("../../etc/passwd")).isEmpty();
    assertThat(gateway.findCached(new RenderKey("proj/doc.qmd", "v1"))).contains(first);
    assertThat(meterRegistry.counter("quartorium.render.cache", "result", "hit").count())
        .isEqualTo(1.0);
    assertThat(Files.readString(projectRoot.resolve("doc.qmd"))).isEqualTo("# Stale copy\n");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("should report renderer output when the renderer fails")
  void shouldThrowWithDiagnostics_whenExitCodeNonZero() {
    QuartoRenderGateway gateway = gatewayRunning("echo 'ERROR: bad chunk option'; exit 3");

    assertThatThrownBy(() -> gateway.render(request("v2")))
        .isInstanceOf(RenderFailureException.class)
        .hasMessageContaining("exited with code 3")
        .satisfies(
            e ->
                assertThat(((RenderFailureException) e).getDiagnostics())
                    .contains("ERROR: bad chunk option"));
    assertThat(gateway.cachedEntries()).isZero();
    assertThat(meterRegistry.counter("quartorium.render.runs", "outcome", "failure").count())
        .isEqualTo(1.0);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("should fail when the renderer writes no JATS")
  void shouldThrow_whenNoXmlProduced() {
    QuartoRenderGateway gateway = gatewayRunning("echo done");

    assertThatThrownBy(() -> gateway.render(request("v3")))
        .isInstanceOf(RenderFailureException.class)
        .hasMessageContaining("no JATS output");
  }

  @Test
  @DisplayName("should fail when the renderer cannot be started")
  void shouldThrow_whenExecutableMissing() {
    config.getRender().setExecutable("quartorium-no-such-renderer");
    QuartoRenderGateway gateway = new QuartoRenderGateway(config, meterRegistry);

    assertThatThrownBy(() -> gateway.render(request("v4")))
        .isInstanceOf(RenderFailureException.class)
        .hasMessageContaining("Failed to start renderer");
    assertThat(gateway.findCached(new RenderKey("proj/doc.qmd", "v4"))).isEmpty();
  }

  @Test
  @DisplayName("should derive the content version from the source when none is given")
  void shouldHashContent_whenVersionMissing() {
    RenderRequest request = request(null);

    assertThat(request.contentVersion()).hasSize(64);
    assertThat(request.documentId()).isEqualTo("proj/doc.qmd");
  }
}
