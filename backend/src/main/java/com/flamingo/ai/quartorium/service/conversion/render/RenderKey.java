package com.flamingo.ai.quartorium.service.conversion.render;

import java.util.Objects;

/**
 * Cache identity of a rendered document version.
 *
 * @param documentId project id and source path, joined by {@code /}
 * @param contentVersion commit hash or content digest of the rendered source
 */
public record RenderKey(String documentId, String contentVersion) {

  public RenderKey {
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(contentVersion, "contentVersion must not be null");
  }
}
