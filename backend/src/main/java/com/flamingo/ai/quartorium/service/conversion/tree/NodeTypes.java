package com.flamingo.ai.quartorium.service.conversion.tree;

/** Node type names shared with the editor schema. */
public final class NodeTypes {

  public static final String DOC = "doc";
  public static final String PARAGRAPH = "paragraph";
  public static final String HEADING = "heading";
  public static final String CODE_BLOCK = "codeBlock";
  public static final String QUARTO_BLOCK = "quartoBlock";

  public static final String TEXT = "text";
  public static final String CITATION = "citation";
  public static final String FIGURE_REFERENCE = "figureReference";
  public static final String TABLE_REFERENCE = "tableReference";
  public static final String EQUATION_REFERENCE = "equationReference";

  private NodeTypes() {}

  /** Returns true for the inline nodes that point at a citation, figure, table or equation. */
  public static boolean isReference(String type) {
    return CITATION.equals(type)
        || FIGURE_REFERENCE.equals(type)
        || TABLE_REFERENCE.equals(type)
        || EQUATION_REFERENCE.equals(type);
  }
}
