package com.flamingo.ai.quartorium.api.dto.request;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for writing an edited tree back to source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerializeDocumentRequest {

  @NotNull(message = "Document tree is required")
  private DocNode tree;

  @NotNull(message = "Original source is required")
  private String originalSource;

  @Builder.Default private List<CommentThread> comments = new ArrayList<>();
}
