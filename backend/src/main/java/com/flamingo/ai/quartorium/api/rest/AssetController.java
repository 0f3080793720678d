package com.flamingo.ai.quartorium.api.rest;

import com.flamingo.ai.quartorium.service.conversion.render.RenderGateway;
import com.flamingo.ai.quartorium.service.conversion.render.RenderKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for serving rendered assets such as figure images.
 *
 * <p>Assets are looked up in the render cache only. An asset of a render that is no longer cached
 * answers 404 until the document is viewed again.
 */
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
@Slf4j
public class AssetController {

  private final RenderGateway renderGateway;

  /**
   * Serves a rendered asset.
   *
   * @param documentId percent-encoded project-qualified document path
   * @param version content version of the render
   * @param assetPath asset path relative to the rendered document
   * @return asset bytes with a Content-Type guessed from the file name, or 404 if unknown
   */
  @GetMapping("/{documentId}/{version}/{*assetPath}")
  public ResponseEntity<byte[]> getAsset(
      @PathVariable String documentId,
      @PathVariable String version,
      @PathVariable String assetPath) {
    RenderKey key = new RenderKey(documentId, version);
    return renderGateway
        .findCached(key)
        .flatMap(result -> result.resolveAsset(assetPath))
        .map(this::readAsset)
        .orElseGet(
            () -> {
              log.debug("Asset {} not available for {}", assetPath, key);
              return ResponseEntity.notFound().build();
            });
  }

  private ResponseEntity<byte[]> readAsset(Path file) {
    try {
      byte[] bytes = Files.readAllBytes(file);
      MediaType mediaType =
          MediaTypeFactory.getMediaType(file.getFileName().toString())
              .orElse(MediaType.APPLICATION_OCTET_STREAM);
      return ResponseEntity.ok().contentType(mediaType).body(bytes);
    } catch (IOException e) {
      log.error("Failed to read asset {}: {}", file, e.getMessage());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }
}
