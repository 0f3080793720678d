package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** DOM helpers for JATS elements, which are matched by local name. */
final class JatsElements {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private JatsElements() {}

  static String name(Node node) {
    String local = node.getLocalName();
    return local != null ? local : node.getNodeName();
  }

  static boolean is(Node node, String elementName) {
    return node != null
        && node.getNodeType() == Node.ELEMENT_NODE
        && elementName.equals(name(node));
  }

  static List<Element> children(Element parent) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      if (nodes.item(i) instanceof Element element) {
        result.add(element);
      }
    }
    return result;
  }

  static List<Element> children(Element parent, String elementName) {
    return children(parent).stream().filter(child -> is(child, elementName)).toList();
  }

  static Optional<Element> child(Element parent, String elementName) {
    return children(parent).stream().filter(child -> is(child, elementName)).findFirst();
  }

  /** Follows a path of child element names, e.g. {@code child(root, "front", "article-meta")}. */
  static Optional<Element> child(Element parent, String... path) {
    Optional<Element> current = Optional.ofNullable(parent);
    for (String step : path) {
      current = current.flatMap(element -> child(element, step));
    }
    return current;
  }

  /** First descendant with the given name, in document order. */
  static Optional<Element> descendant(Element parent, String elementName) {
    for (Element child : children(parent)) {
      if (is(child, elementName)) {
        return Optional.of(child);
      }
      Optional<Element> nested = descendant(child, elementName);
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  /** Attribute value, or null when the attribute is absent or blank. */
  static String attr(Element element, String attribute) {
    String value = element.getAttribute(attribute);
    return value == null || value.isBlank() ? null : value.trim();
  }

  static String collapse(String text) {
    return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ");
  }

  /** Whitespace-collapsed, trimmed text content. */
  static String text(Node node) {
    return node == null ? "" : collapse(node.getTextContent()).trim();
  }

  static String childText(Element parent, String elementName) {
    return child(parent, elementName)
        .map(JatsElements::text)
        .filter(text -> !text.isEmpty())
        .orElse(null);
  }
}
