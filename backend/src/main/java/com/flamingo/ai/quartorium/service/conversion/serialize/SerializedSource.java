package com.flamingo.ai.quartorium.service.conversion.serialize;

import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import java.util.List;

/**
 * Serialized QMD source with a per-block provenance report.
 *
 * @param text complete source, ending with a single newline
 * @param blocks provenance of every emitted block in output order
 * @param comments comment threads written to the appendix
 */
public record SerializedSource(
    String text, List<BlockReport> blocks, List<CommentThread> comments) {

  public SerializedSource {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
    comments = comments == null ? List.of() : List.copyOf(comments);
  }

  public long count(BlockProvenance provenance) {
    return blocks.stream().filter(block -> block.provenance() == provenance).count();
  }
}
