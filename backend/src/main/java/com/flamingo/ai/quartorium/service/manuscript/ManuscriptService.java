package com.flamingo.ai.quartorium.service.manuscript;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.serialize.SerializedSource;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import java.util.List;

/** Service interface for the source to editor round trip. */
public interface ManuscriptService {

  /**
   * Renders a source document and builds its editor view.
   *
   * @param projectId the project ID
   * @param documentPath source path relative to the project
   * @param contentVersion version identifier, or null to derive one from the content
   * @return the document tree with its comment threads
   * @throws com.flamingo.ai.quartorium.exception.RenderFailureException if rendering fails
   * @throws com.flamingo.ai.quartorium.exception.MalformedSourceException if the rendered markup
   *     is unusable
   */
  DocumentView loadView(String projectId, String documentPath, String contentVersion);

  /**
   * Writes an edited tree back to source.
   *
   * @param tree the edited document tree
   * @param originalSource the source the tree was loaded from
   * @param comments comment threads to keep with the document
   * @return the new source and how each block was obtained
   */
  SerializedSource serialize(DocNode tree, String originalSource, List<CommentThread> comments);
}
