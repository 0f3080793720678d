package com.flamingo.ai.quartorium.api.dto.response;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.serialize.BlockProvenance;
import com.flamingo.ai.quartorium.service.conversion.serialize.BlockReport;
import com.flamingo.ai.quartorium.service.conversion.serialize.SerializedSource;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for serialized source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerializedDocumentResponse {

  private String source;
  private List<CommentThread> comments;
  private List<BlockReport> blocks;
  private long reconstructedBlocks;

  /** Creates a SerializedDocumentResponse from a SerializedSource. */
  public static SerializedDocumentResponse fromSerialized(SerializedSource serialized) {
    return SerializedDocumentResponse.builder()
        .source(serialized.text())
        .comments(serialized.comments())
        .blocks(serialized.blocks())
        .reconstructedBlocks(serialized.count(BlockProvenance.RECONSTRUCTED))
        .build();
  }
}
