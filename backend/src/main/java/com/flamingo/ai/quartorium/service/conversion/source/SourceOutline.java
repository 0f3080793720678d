package com.flamingo.ai.quartorium.service.conversion.source;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Structural facts about QMD prose that the rendered markup does not carry. */
public final class SourceOutline {

  private static final Pattern ATX_HEADING = Pattern.compile("^ {0,3}(#{1,6})(?:\\s|$)");

  private SourceOutline() {}

  /**
   * Returns the smallest ATX heading level used outside frontmatter and code fences, or 1 when the
   * source has no headings. The renderer numbers sections from 1 regardless of the level written
   * in the source.
   */
  public static int baseHeadingLevel(String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return 1;
    }
    int min = Integer.MAX_VALUE;
    boolean seenContent = false;
    boolean inFrontmatter = false;
    CodeFences.FenceMarker fence = null;

    for (String line : BlockIndexer.splitLines(rawText)) {
      String content = BlockIndexer.stripTerminator(line);
      String trimmed = content.trim();
      if (inFrontmatter) {
        inFrontmatter = !(trimmed.equals("---") || trimmed.equals("..."));
        continue;
      }
      if (fence != null) {
        if (CodeFences.closes(fence, trimmed)) {
          fence = null;
        }
        continue;
      }
      if (!seenContent && trimmed.equals("---")) {
        inFrontmatter = true;
        seenContent = true;
        continue;
      }
      if (!trimmed.isEmpty()) {
        seenContent = true;
      }
      fence = CodeFences.scan(trimmed);
      if (fence != null) {
        continue;
      }
      Matcher heading = ATX_HEADING.matcher(content);
      if (heading.find()) {
        min = Math.min(min, heading.group(1).length());
      }
    }
    return min == Integer.MAX_VALUE ? 1 : min;
  }
}
