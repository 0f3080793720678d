package com.flamingo.ai.quartorium.service.conversion.tree;

/** Attribute names used on document tree nodes and marks. */
public final class NodeAttrs {

  // doc
  public static final String METADATA = "metadata";
  public static final String BIBLIOGRAPHY = "bibliography";

  // heading
  public static final String LEVEL = "level";

  // paragraph written as a list item; nesting depth, 0 for a top-level list
  public static final String LIST_DEPTH = "listDepth";

  // codeBlock and quartoBlock
  public static final String BLOCK_KEY = "blockKey";
  public static final String LANGUAGE = "language";
  public static final String CODE = "code";
  public static final String FIG_ID = "figId";
  public static final String FIG_LABEL = "figLabel";
  public static final String FIG_CAPTION = "figCaption";
  public static final String IMAGE_SRC = "imageSrc";
  public static final String HTML_OUTPUT = "htmlOutput";

  // reference nodes
  public static final String RID = "rid";
  public static final String LABEL = "label";
  public static final String ORIGINAL_KEY = "originalKey";

  // comment mark
  public static final String COMMENT_ID = "commentId";

  /** {@code language} of a quartoBlock carrying a reconstructed pipe table. */
  public static final String LANGUAGE_TABLE = "table";

  /** {@code language} of a quartoBlock carrying a display equation. */
  public static final String LANGUAGE_EQUATION = "equation";

  /** {@code language} of the quartoBlock standing for the YAML frontmatter. */
  public static final String LANGUAGE_METADATA = "metadata";

  /** {@code language} of the quartoBlock standing for the rendered reference list. */
  public static final String LANGUAGE_BIBLIOGRAPHY = "bibliography";

  private NodeAttrs() {}
}
