package com.flamingo.ai.quartorium.service.conversion.serialize;

import com.flamingo.ai.quartorium.service.conversion.jats.RendererIdNormalizer;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the source key of a citation or cross-reference node.
 *
 * <p>Resolution order: the node's {@code originalKey}, the key map built from the tree, a label
 * that already looks like a key, a key derived from the renderer id, and finally the unresolved
 * marker {@value #UNRESOLVED_KEY}. A reference is never dropped.
 */
@Slf4j
class ReferenceKeyResolver {

  static final String UNRESOLVED_KEY = "??";

  private static final Pattern KEY_LIKE =
      Pattern.compile("^@?[\\p{L}\\p{N}_][\\p{L}\\p{N}_:.#$%&+?<>~/-]*$");

  private final Map<String, String> citationKeys;
  private final Map<String, String> crossReferenceKeys;

  /**
   * @param citationKeys normalized reference id to citation key
   * @param crossReferenceKeys normalized figure, table or equation id to label
   */
  ReferenceKeyResolver(Map<String, String> citationKeys, Map<String, String> crossReferenceKeys) {
    this.citationKeys = citationKeys;
    this.crossReferenceKeys = crossReferenceKeys;
  }

  String resolve(DocNode node) {
    String originalKey = node.stringAttr(NodeAttrs.ORIGINAL_KEY);
    if (originalKey != null) {
      return stripAt(originalKey.trim());
    }

    boolean citation = node.isType(NodeTypes.CITATION);
    String rid = node.stringAttr(NodeAttrs.RID);
    String normalized = RendererIdNormalizer.normalize(rid);
    if (normalized != null) {
      String mapped = (citation ? citationKeys : crossReferenceKeys).get(normalized);
      if (mapped != null) {
        return mapped;
      }
    }

    String label = node.stringAttr(NodeAttrs.LABEL);
    if (label != null && KEY_LIKE.matcher(label.trim()).matches()) {
      return stripAt(label.trim());
    }

    if (normalized != null && !normalized.isEmpty()) {
      return citation ? RendererIdNormalizer.citationKey(normalized) : normalized;
    }

    log.warn("Unresolved {} reference (rid={}, label={})", node.type(), rid, label);
    return UNRESOLVED_KEY;
  }

  private static String stripAt(String key) {
    return key.startsWith("@") ? key.substring(1) : key;
  }
}
