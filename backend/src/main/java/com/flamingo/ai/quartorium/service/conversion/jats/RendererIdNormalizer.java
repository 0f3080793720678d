package com.flamingo.ai.quartorium.service.conversion.jats;

/**
 * Maps element ids written by the renderer back to the ids used in the source.
 *
 * <p>The notebook sub-article repeats every id of the main article with a {@code -nb-article}
 * suffix. All lookups and key derivations go through {@link #normalize(String)} so that both
 * spellings resolve to the same entry.
 */
public final class RendererIdNormalizer {

  static final String NOTEBOOK_SUFFIX = "-nb-article";
  private static final String REFERENCE_PREFIX = "ref-";
  private static final String CELL_PREFIX = "cell-";

  private RendererIdNormalizer() {}

  /** Strips the notebook suffix; {@code fig-plot-nb-article} becomes {@code fig-plot}. */
  public static String normalize(String id) {
    if (id == null) {
      return null;
    }
    String trimmed = id.trim();
    return trimmed.endsWith(NOTEBOOK_SUFFIX)
        ? trimmed.substring(0, trimmed.length() - NOTEBOOK_SUFFIX.length())
        : trimmed;
  }

  /** Citation key of a reference id; {@code ref-knuth84-nb-article} becomes {@code knuth84}. */
  public static String citationKey(String referenceId) {
    String normalized = normalize(referenceId);
    if (normalized == null) {
      return null;
    }
    boolean prefixed =
        normalized.startsWith(REFERENCE_PREFIX) && normalized.length() > REFERENCE_PREFIX.length();
    return prefixed ? normalized.substring(REFERENCE_PREFIX.length()) : normalized;
  }

  /**
   * Chunk label of an executable cell id; {@code cell-fig-plot-nb-article} becomes {@code
   * fig-plot}. Returns null for ids without the cell prefix.
   */
  public static String cellLabel(String cellId) {
    String normalized = normalize(cellId);
    if (normalized == null || !normalized.startsWith(CELL_PREFIX)) {
      return null;
    }
    String label = normalized.substring(CELL_PREFIX.length());
    return label.isEmpty() ? null : label;
  }
}
