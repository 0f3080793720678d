package com.flamingo.ai.quartorium.service.conversion.source;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A verbatim non-prose span of QMD source.
 *
 * @param key block key (label, reserved key or synthetic positional key)
 * @param kind what the span contains
 * @param raw exact source text including delimiters, without the final line terminator
 * @param synthetic {@code true} when the key was generated from the block position
 */
public record SourceBlock(String key, BlockKind kind, String raw, boolean synthetic) {

  private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

  /**
   * Returns the payload of the block with delimiters and chunk option lines removed: the code of a
   * chunk, the TeX of an equation, the rows of a table, the YAML of the frontmatter.
   */
  public String body() {
    List<String> lines = new ArrayList<>(List.of(LINE_BREAK.split(raw, -1)));
    switch (kind) {
      case CODE_CHUNK -> {
        if (!lines.isEmpty()) {
          lines.remove(0);
        }
        if (!lines.isEmpty() && CodeFences.isFenceLine(lines.get(lines.size() - 1).trim())) {
          lines.remove(lines.size() - 1);
        }
        lines.removeIf(line -> line.trim().startsWith("#|"));
        return String.join("\n", lines).strip();
      }
      case FRONTMATTER -> {
        if (!lines.isEmpty()) {
          lines.remove(0);
        }
        if (!lines.isEmpty()) {
          lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
      }
      case EQUATION -> {
        String text = raw.strip();
        int open = text.indexOf("$$");
        int close = text.indexOf("$$", open + 2);
        return open >= 0 && close > open ? text.substring(open + 2, close).strip() : text;
      }
      default -> {
        lines.removeIf(line -> !line.trim().startsWith("|"));
        return String.join("\n", lines);
      }
    }
  }
}
