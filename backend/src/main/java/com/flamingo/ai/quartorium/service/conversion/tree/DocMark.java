package com.flamingo.ai.quartorium.service.conversion.tree;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A mark applied to a text node, such as {@code strong} or {@code comment}. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DocMark(String type, Map<String, Object> attrs) {

  public DocMark {
    attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public static DocMark of(MarkType type) {
    return new DocMark(type.typeName(), Map.of());
  }

  public static DocMark comment(String commentId) {
    return new DocMark(MarkType.COMMENT.typeName(), Map.of(NodeAttrs.COMMENT_ID, commentId));
  }

  public String attr(String name) {
    Object value = attrs.get(name);
    return value == null ? null : value.toString();
  }
}
