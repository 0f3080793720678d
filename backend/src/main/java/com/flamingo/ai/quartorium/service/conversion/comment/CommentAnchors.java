package com.flamingo.ai.quartorium.service.conversion.comment;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Prepares comment anchors for rendering.
 *
 * <p>Comment anchors are written as {@code [text]{.comment ref="id"}}. The JATS writer drops span
 * classes and unknown attributes, so such a span would vanish from the rendered markup. Before
 * rendering, each anchor gains {@code content-type="comment"} and {@code rid="id"}, which the
 * writer keeps on a {@code named-content} element. Fenced code is left untouched.
 */
@Component
@Slf4j
public class CommentAnchors {

  /** Group 1 is the attribute list of a span carrying the {@code comment} class. */
  static final Pattern ANCHOR_ATTRIBUTES =
      Pattern.compile("](\\{[^{}\\n]*?\\.comment(?=[\\s}])[^{}\\n]*})");

  private static final Pattern REF =
      Pattern.compile("\\bref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s\"'}]+))");
  private static final Pattern CONTENT_TYPE = Pattern.compile("\\bcontent-type\\s*=");
  private static final Pattern FENCE = Pattern.compile("^\\s*(`{3,}|~{3,})");

  /**
   * Returns {@code source} with every comment anchor outside fenced code annotated for the JATS
   * writer. Anchors without a {@code ref}, or already carrying a {@code content-type}, are kept
   * as they are.
   */
  public String annotateForRender(String source) {
    if (source == null || !source.contains(".comment")) {
      return source;
    }
    StringBuilder out = new StringBuilder(source.length() + 64);
    String fence = null;
    int annotated = 0;
    int start = 0;
    while (start < source.length()) {
      int newline = source.indexOf('\n', start);
      int end = newline < 0 ? source.length() : newline + 1;
      String line = source.substring(start, end);
      Matcher fenceMatcher = FENCE.matcher(line);
      if (fence == null && fenceMatcher.find()) {
        fence = fenceMatcher.group(1);
        out.append(line);
      } else if (fence != null) {
        if (fenceMatcher.find()
            && fenceMatcher.group(1).charAt(0) == fence.charAt(0)
            && fenceMatcher.group(1).length() >= fence.length()) {
          fence = null;
        }
        out.append(line);
      } else {
        Matcher anchor = ANCHOR_ATTRIBUTES.matcher(line);
        StringBuilder rewritten = new StringBuilder(line.length() + 32);
        while (anchor.find()) {
          String attributes = anchor.group(1);
          String replacement = annotate(attributes);
          if (!replacement.equals(attributes)) {
            annotated++;
          }
          anchor.appendReplacement(rewritten, Matcher.quoteReplacement("]" + replacement));
        }
        anchor.appendTail(rewritten);
        out.append(rewritten);
      }
      start = end;
    }
    log.debug("Annotated {} comment anchors for rendering", annotated);
    return out.toString();
  }

  private static String annotate(String attributes) {
    if (CONTENT_TYPE.matcher(attributes).find()) {
      return attributes;
    }
    Matcher ref = REF.matcher(attributes);
    if (!ref.find()) {
      log.warn("Comment anchor without a ref attribute: {}", attributes);
      return attributes;
    }
    String id = ref.group(1);
    if (id == null) {
      id = ref.group(2) != null ? ref.group(2) : ref.group(3);
    }
    String body = attributes.substring(0, attributes.length() - 1);
    return body + " content-type=\"comment\" rid=\"" + id + "\"}";
  }
}
