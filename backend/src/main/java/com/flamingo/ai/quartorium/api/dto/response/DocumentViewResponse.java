package com.flamingo.ai.quartorium.api.dto.response;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.manuscript.DocumentView;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the editor view of a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentViewResponse {

  private String documentId;
  private String contentVersion;
  private DocNode tree;
  private List<CommentThread> comments;

  /** Creates a DocumentViewResponse from a DocumentView. */
  public static DocumentViewResponse fromView(DocumentView view) {
    return DocumentViewResponse.builder()
        .documentId(view.documentId())
        .contentVersion(view.contentVersion())
        .tree(view.tree())
        .comments(view.comments())
        .build();
  }
}
