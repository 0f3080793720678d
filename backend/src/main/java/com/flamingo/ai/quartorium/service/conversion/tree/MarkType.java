package com.flamingo.ai.quartorium.service.conversion.tree;

import java.util.Locale;
import java.util.Optional;

/** Inline marks understood by the serializer. */
public enum MarkType {
  COMMENT("comment"),
  STRIKETHROUGH("strikethrough"),
  STRONG("strong"),
  EM("em"),
  CODE("code");

  private final String typeName;

  MarkType(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  /**
   * Resolves a mark type name. The editor aliases {@code bold}, {@code italic} and {@code strike}
   * are accepted.
   */
  public static Optional<MarkType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "comment" -> Optional.of(COMMENT);
      case "strikethrough", "strike" -> Optional.of(STRIKETHROUGH);
      case "strong", "bold" -> Optional.of(STRONG);
      case "em", "italic" -> Optional.of(EM);
      case "code", "monospace" -> Optional.of(CODE);
      default -> Optional.empty();
    };
  }
}
