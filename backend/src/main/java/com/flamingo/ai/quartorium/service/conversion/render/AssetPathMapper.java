package com.flamingo.ai.quartorium.service.conversion.render;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps rendered asset locations to public URLs and back.
 *
 * <p>URLs have the form {@code {prefix}/{documentId}/{version}/{relativePath}}. The document id
 * and the version are percent-encoded as single path segments.
 */
@Component
@RequiredArgsConstructor
public class AssetPathMapper {

  private final QuartoriumConfig config;

  public AssetBaseRef baseRef(RenderKey key) {
    return new AssetBaseRef(config.getAssets().getUrlPrefix(), key);
  }

  public String toUrl(RenderKey key, String relativePath) {
    return baseRef(key).resolve(relativePath);
  }

  /**
   * Parses a public asset URL back into the render key and the asset path.
   *
   * @return empty if {@code url} does not start with the configured prefix or has too few segments
   */
  public Optional<AssetLocation> fromUrl(String url) {
    if (url == null) {
      return Optional.empty();
    }
    String prefix = config.getAssets().getUrlPrefix();
    if (prefix.endsWith("/")) {
      prefix = prefix.substring(0, prefix.length() - 1);
    }
    if (!url.startsWith(prefix + "/")) {
      return Optional.empty();
    }
    String[] parts = url.substring(prefix.length() + 1).split("/", 3);
    if (parts.length < 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
      return Optional.empty();
    }
    RenderKey key = new RenderKey(decode(parts[0]), decode(parts[1]));
    return Optional.of(new AssetLocation(key, decodePath(parts[2])));
  }

  private static String decode(String segment) {
    // path segments never carry form encoding, keep a literal '+'
    return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
  }

  private static String decodePath(String path) {
    return Arrays.stream(path.split("/", -1))
        .map(AssetPathMapper::decode)
        .collect(Collectors.joining("/"));
  }

  /** Render key and asset path decoded from a public URL. */
  public record AssetLocation(RenderKey key, String relativePath) {}
}
