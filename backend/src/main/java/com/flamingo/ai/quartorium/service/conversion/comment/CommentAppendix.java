package com.flamingo.ai.quartorium.service.conversion.comment;

import java.util.regex.Pattern;

/** On-disk format of the comments appendix appended to QMD source. */
final class CommentAppendix {

  static final String MARKER = "<!-- Comments Appendix -->";
  static final String CONTAINER_OPEN = "<div id=\"quartorium-comments\" style=\"display:none;\">";
  static final String CONTAINER_CLOSE = "</div>";
  static final String JSON_FENCE_OPEN = "```json";
  static final String JSON_FENCE_CLOSE = "```";

  /** Group 1 captures the JSON payload. */
  static final Pattern PATTERN =
      Pattern.compile(
          Pattern.quote(MARKER)
              + "\\s*"
              + Pattern.quote(CONTAINER_OPEN)
              + "\\s*```json\\s*(.*?)\\s*```\\s*"
              + Pattern.quote(CONTAINER_CLOSE),
          Pattern.DOTALL);

  private CommentAppendix() {}
}
