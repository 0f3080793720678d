package com.flamingo.ai.quartorium.service.manuscript;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import java.util.List;

/**
 * Editor view of a source document.
 *
 * @param documentId project-qualified document path
 * @param contentVersion version the tree was rendered from
 * @param tree editor document tree
 * @param comments comment threads found in the source appendix
 */
public record DocumentView(
    String documentId, String contentVersion, DocNode tree, List<CommentThread> comments) {

  public DocumentView {
    comments = comments == null ? List.of() : List.copyOf(comments);
  }
}
