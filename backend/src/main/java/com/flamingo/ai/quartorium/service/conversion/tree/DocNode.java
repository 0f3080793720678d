package com.flamingo.ai.quartorium.service.conversion.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the editor document tree.
 *
 * <p>The JSON shape follows the editor schema: {@code {type, attrs, content, text, marks}} with
 * empty members omitted. Instances are immutable; attribute values may be null.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DocNode(
    String type,
    Map<String, Object> attrs,
    List<DocNode> content,
    String text,
    List<DocMark> marks) {

  public DocNode {
    attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    content = content == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(content));
    marks = marks == null ? List.of() : List.copyOf(marks);
  }

  public static DocNode doc(Map<String, Object> attrs, List<DocNode> content) {
    return new DocNode(NodeTypes.DOC, attrs, content, null, null);
  }

  public static DocNode paragraph(List<DocNode> content) {
    return new DocNode(NodeTypes.PARAGRAPH, null, content, null, null);
  }

  public static DocNode heading(int level, List<DocNode> content) {
    return new DocNode(NodeTypes.HEADING, Map.of(NodeAttrs.LEVEL, level), content, null, null);
  }

  public static DocNode text(String text, List<DocMark> marks) {
    return new DocNode(NodeTypes.TEXT, null, null, text, marks);
  }

  public static DocNode text(String text) {
    return text(text, null);
  }

  public static DocNode block(String type, Map<String, Object> attrs) {
    return new DocNode(type, attrs, null, null, null);
  }

  public boolean isType(String candidate) {
    return candidate != null && candidate.equals(type);
  }

  @JsonIgnore
  public boolean isTextNode() {
    return isType(NodeTypes.TEXT);
  }

  public Object attr(String name) {
    return attrs.get(name);
  }

  /** Returns the attribute as a string, or null when absent or blank. */
  public String stringAttr(String name) {
    Object value = attrs.get(name);
    if (value == null) {
      return null;
    }
    String string = value.toString();
    return string.isBlank() ? null : string;
  }

  public int intAttr(String name, int defaultValue) {
    Object value = attrs.get(name);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String string) {
      try {
        return Integer.parseInt(string.trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  /** Concatenated text of this node and its descendants. */
  public String textContent() {
    if (text != null) {
      return text;
    }
    StringBuilder sb = new StringBuilder();
    for (DocNode child : content) {
      sb.append(child.textContent());
    }
    return sb.toString();
  }

  /** Returns a copy with {@code name} set to {@code value}. */
  public DocNode withAttr(String name, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(attrs);
    copy.put(name, value);
    return new DocNode(type, copy, content, text, marks);
  }
}
