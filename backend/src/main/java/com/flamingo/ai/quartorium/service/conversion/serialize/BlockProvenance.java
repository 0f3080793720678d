package com.flamingo.ai.quartorium.service.conversion.serialize;

/** How the source text of one serialized block was obtained. */
public enum BlockProvenance {
  /** Copied verbatim from the block map by key. */
  PRESERVED,
  /** Copied verbatim from an unlabeled source block with identical content. */
  MATCHED_BY_CONTENT,
  /** Rebuilt from node attributes; formatting and chunk options may differ from the original. */
  RECONSTRUCTED,
  /** Prose written from the edited tree. */
  PROSE
}
