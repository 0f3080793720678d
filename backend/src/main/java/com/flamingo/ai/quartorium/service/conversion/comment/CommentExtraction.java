package com.flamingo.ai.quartorium.service.conversion.comment;

import java.util.List;

/**
 * Result of splitting the comments appendix off QMD source.
 *
 * @param comments threads found in the appendix (empty when absent or malformed)
 * @param remainingText source text with the appendix removed
 */
public record CommentExtraction(List<CommentThread> comments, String remainingText) {

  public CommentExtraction {
    comments = comments == null ? List.of() : List.copyOf(comments);
  }
}
