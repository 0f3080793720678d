package com.flamingo.ai.quartorium.service.conversion.render;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import com.flamingo.ai.quartorium.exception.RenderFailureException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders QMD source to JATS by running the Quarto command line in an isolated project snapshot.
 *
 * <p>Every render copies the project into a fresh directory under the configured work directory
 * and writes the comment-free source over the copied file, so concurrent renders never share
 * files. Successful results are cached by document id and content version; the snapshot of an
 * evicted result is deleted. Failures are reported with the renderer output and are not cached.
 */
@Service
@Slf4j
public class QuartoRenderGateway implements RenderGateway {

  private static final String SOURCE_PLACEHOLDER = "{source}";
  private static final String OUTPUT_DIR_PLACEHOLDER = "{outputDir}";
  private static final String OUTPUT_DIR_NAME = "_rendered";
  private static final String RENDER_LOG_NAME = ".render.log";
  private static final int MAX_DIAGNOSTICS_LENGTH = 8000;

  private final QuartoriumConfig config;
  private final MeterRegistry meterRegistry;
  private final Cache<RenderKey, RenderResult> cache;

  public QuartoRenderGateway(QuartoriumConfig config, MeterRegistry meterRegistry) {
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(Math.max(1, config.getRender().getCacheMaxEntries()))
            .removalListener(
                (RenderKey key, RenderResult result, RemovalCause cause) -> {
                  log.debug("Render of {} removed from cache ({})", key, cause);
                  if (result != null) {
                    ProjectSnapshots.deleteQuietly(result.snapshotDir());
                  }
                })
            .build();
  }

  @Override
  @Timed(value = "quartorium.render", description = "Time to render a document to JATS")
  public RenderResult render(RenderRequest request) {
    RenderKey key = request.key();
    RenderResult cached = cache.getIfPresent(key);
    if (cached != null) {
      log.debug("Render cache hit for {}", key);
      meterRegistry.counter("quartorium.render.cache", "result", "hit").increment();
      return cached;
    }
    meterRegistry.counter("quartorium.render.cache", "result", "miss").increment();
    return cache.get(key, k -> renderUncached(request, k));
  }

  @Override
  public Optional<RenderResult> findCached(RenderKey key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @PreDestroy
  void shutdown() {
    cache.invalidateAll();
    cache.cleanUp();
  }

  @VisibleForTesting
  long cachedEntries() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private RenderResult renderUncached(RenderRequest request, RenderKey key) {
    String documentId = key.documentId();
    Path snapshot;
    try {
      snapshot = createSnapshot(request);
    } catch (IOException e) {
      throw new RenderFailureException(
          documentId, "Failed to prepare render snapshot", e.getMessage(), e);
    }

    try {
      RenderResult result = runRenderer(request, key, snapshot);
      meterRegistry.counter("quartorium.render.runs", "outcome", "success").increment();
      return result;
    } catch (RenderFailureException e) {
      meterRegistry.counter("quartorium.render.runs", "outcome", "failure").increment();
      ProjectSnapshots.deleteQuietly(snapshot);
      throw e;
    }
  }

  private Path createSnapshot(RenderRequest request) throws IOException {
    Path workDir = workDirectory();
    Files.createDirectories(workDir);
    Path snapshot = Files.createTempDirectory(workDir, "render-");
    if (Files.isDirectory(request.projectRoot())) {
      ProjectSnapshots.copyProject(request.projectRoot(), snapshot);
    }
    Path source = snapshot.resolve(request.sourcePath()).normalize();
    if (!source.startsWith(snapshot)) {
      throw new IOException("Source path escapes the project: " + request.sourcePath());
    }
    Files.createDirectories(source.getParent());
    Files.writeString(source, request.sourceText(), StandardCharsets.UTF_8);
    log.debug("Prepared render snapshot {} for {}", snapshot, request.documentId());
    return snapshot;
  }

  private RenderResult runRenderer(RenderRequest request, RenderKey key, Path snapshot) {
    String documentId = key.documentId();
    Path source = snapshot.resolve(request.sourcePath()).normalize();
    Path outputDir = snapshot.resolve(OUTPUT_DIR_NAME);
    Path renderLog = snapshot.resolve(RENDER_LOG_NAME);
    List<String> command = buildCommand(source, outputDir);
    int timeoutSeconds = config.getRender().getTimeoutSeconds();

    log.info("Rendering {} (version {})", documentId, key.contentVersion());
    log.debug("Render command: {}", command);

    Process process;
    try {
      Files.createDirectories(outputDir);
      process =
          new ProcessBuilder(command)
              .directory(source.getParent().toFile())
              .redirectErrorStream(true)
              .redirectOutput(renderLog.toFile())
              .start();
    } catch (IOException e) {
      throw new RenderFailureException(
          documentId, "Failed to start renderer " + command.get(0), e.getMessage(), e);
    }

    try {
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new RenderFailureException(
            documentId,
            "Renderer timed out after " + timeoutSeconds + " seconds",
            readDiagnostics(renderLog));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new RenderFailureException(
          documentId, "Interrupted while waiting for renderer", readDiagnostics(renderLog), e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      throw new RenderFailureException(
          documentId, "Renderer exited with code " + exitCode, readDiagnostics(renderLog));
    }

    String baseName = baseName(source);
    Optional<Path> rendered =
        findXml(outputDir, baseName, true).or(() -> findXml(source.getParent(), baseName, false));
    if (rendered.isEmpty()) {
      throw new RenderFailureException(
          documentId, "Renderer produced no JATS output", readDiagnostics(renderLog));
    }
    Path xmlFile = rendered.get();

    String xml;
    try {
      xml = Files.readString(xmlFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RenderFailureException(
          documentId, "Failed to read rendered JATS", e.getMessage(), e);
    }

    Path assetDir = findAssetDir(baseName, outputDir, source.getParent());
    if (assetDir == null) {
      log.debug("No asset directory written for {}", documentId);
    }
    log.info("Rendered {} ({} chars of JATS)", documentId, xml.length());
    return new RenderResult(
        key, xml, snapshot, xmlFile.getParent(), source.getParent(), assetDir);
  }

  @VisibleForTesting
  List<String> buildCommand(Path source, Path outputDir) {
    List<String> command = new ArrayList<>();
    command.add(config.getRender().getExecutable());
    for (String argument : config.getRender().getArguments()) {
      command.add(
          argument
              .replace(SOURCE_PLACEHOLDER, source.getFileName().toString())
              .replace(OUTPUT_DIR_PLACEHOLDER, outputDir.toAbsolutePath().toString()));
    }
    return command;
  }

  private Path workDirectory() {
    String configured = config.getRender().getWorkDir();
    if (configured == null || configured.isBlank()) {
      return Path.of(System.getProperty("java.io.tmpdir"), "quartorium-renders");
    }
    return Path.of(configured);
  }

  /** Looks for {@code <baseName>.xml}, then for any XML file when {@code anyXml} is set. */
  private static Optional<Path> findXml(Path dir, String baseName, boolean anyXml) {
    if (dir == null || !Files.isDirectory(dir)) {
      return Optional.empty();
    }
    Path expected = dir.resolve(baseName + ".xml");
    if (Files.isRegularFile(expected)) {
      return Optional.of(expected);
    }
    if (!anyXml) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(file -> file.getFileName().toString().endsWith(".xml"))
          .sorted()
          .findFirst();
    } catch (IOException e) {
      log.warn("Failed to list render output in {}: {}", dir, e.getMessage());
      return Optional.empty();
    }
  }

  private static Path findAssetDir(String baseName, Path... candidates) {
    for (Path dir : candidates) {
      Path assets = dir.resolve(baseName + "_files");
      if (Files.isDirectory(assets)) {
        return assets;
      }
    }
    return null;
  }

  private static String baseName(Path source) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static String readDiagnostics(Path renderLog) {
    try {
      if (!Files.exists(renderLog)) {
        return "";
      }
      String output = Files.readString(renderLog, StandardCharsets.UTF_8);
      return output.length() > MAX_DIAGNOSTICS_LENGTH
          ? output.substring(output.length() - MAX_DIAGNOSTICS_LENGTH)
          : output;
    } catch (IOException e) {
      return "Renderer output unavailable: " + e.getMessage();
    }
  }
}
