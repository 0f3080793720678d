package com.flamingo.ai.quartorium.service.conversion.render;

import com.google.common.net.UrlEscapers;
import java.util.Locale;

/**
 * Base URL under which the assets of one rendered document version are served.
 *
 * @param urlPrefix public prefix of the asset endpoint, e.g. {@code /api/assets}
 * @param key rendered document version
 */
public record AssetBaseRef(String urlPrefix, RenderKey key) {

  /**
   * Rewrites an image reference from the rendered markup into a public URL. Absolute URLs, data
   * URIs and root-relative paths are returned unchanged.
   */
  public String resolve(String src) {
    if (src == null || src.isBlank()) {
      return src;
    }
    String lower = src.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http:")
        || lower.startsWith("https:")
        || lower.startsWith("data:")
        || src.startsWith("/")) {
      return src;
    }
    String relative = src.startsWith("./") ? src.substring(2) : src;
    return baseUrl() + "/" + UrlEscapers.urlFragmentEscaper().escape(relative);
  }

  /** Returns {@code prefix/encodedDocumentId/encodedVersion}. */
  public String baseUrl() {
    String prefix = urlPrefix;
    if (prefix.endsWith("/")) {
      prefix = prefix.substring(0, prefix.length() - 1);
    }
    return prefix
        + "/"
        + UrlEscapers.urlPathSegmentEscaper().escape(key.documentId())
        + "/"
        + UrlEscapers.urlPathSegmentEscaper().escape(key.contentVersion());
  }
}
