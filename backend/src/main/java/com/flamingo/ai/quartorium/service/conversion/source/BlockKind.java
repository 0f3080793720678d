package com.flamingo.ai.quartorium.service.conversion.source;

/** Kinds of non-prose spans captured from QMD source. */
public enum BlockKind {
  FRONTMATTER,
  CODE_CHUNK,
  TABLE,
  EQUATION
}
