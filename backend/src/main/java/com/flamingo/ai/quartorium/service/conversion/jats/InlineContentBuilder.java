package com.flamingo.ai.quartorium.service.conversion.jats;

import com.flamingo.ai.quartorium.service.conversion.tree.DocMark;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.MarkType;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Accumulates the inline content of one paragraph or heading.
 *
 * <p>Text is whitespace-collapsed, formatting elements become marks and cross references become
 * reference nodes. Adjacent text with identical marks is merged and the content is trimmed at its
 * edges when {@link #build()} is called.
 */
@Slf4j
final class InlineContentBuilder {

  private static final String COMMENT_TYPE = "comment";
  private static final String[] COMMENT_ID_ATTRIBUTES = {
    "ref", "data-ref", "specific-use", "rid", "id"
  };

  private final ReferenceContext context;
  private final List<DocNode> nodes = new ArrayList<>();

  InlineContentBuilder(ReferenceContext context) {
    this.context = context;
  }

  void appendChildren(Element parent, List<DocMark> marks) {
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      append(children.item(i), marks);
    }
  }

  void append(Node node, List<DocMark> marks) {
    switch (node.getNodeType()) {
      case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> appendText(node.getNodeValue(), marks);
      case Node.ELEMENT_NODE -> appendElement((Element) node, marks);
      default -> {
        // comments and processing instructions carry no content
      }
    }
  }

  void appendText(String raw, List<DocMark> marks) {
    String text = JatsElements.collapse(raw);
    if (text.isEmpty()) {
      return;
    }
    if (text.startsWith(" ") && endsWithSpace()) {
      text = text.substring(1);
      if (text.isEmpty()) {
        return;
      }
    }
    nodes.add(DocNode.text(text, marks));
  }

  boolean isEmpty() {
    return build().isEmpty();
  }

  /** Returns the trimmed, merged content and resets the builder. */
  List<DocNode> drain() {
    List<DocNode> content = build();
    nodes.clear();
    return content;
  }

  List<DocNode> build() {
    List<DocNode> merged = new ArrayList<>();
    for (DocNode node : nodes) {
      int last = merged.size() - 1;
      if (last >= 0
          && node.isTextNode()
          && merged.get(last).isTextNode()
          && merged.get(last).marks().equals(node.marks())) {
        DocNode previous = merged.remove(last);
        merged.add(DocNode.text(previous.text() + node.text(), node.marks()));
      } else {
        merged.add(node);
      }
    }
    if (!merged.isEmpty() && merged.get(0).isTextNode()) {
      DocNode first = merged.get(0);
      merged.set(0, DocNode.text(first.text().stripLeading(), first.marks()));
    }
    int last = merged.size() - 1;
    if (last >= 0 && merged.get(last).isTextNode()) {
      DocNode end = merged.get(last);
      merged.set(last, DocNode.text(end.text().stripTrailing(), end.marks()));
    }
    merged.removeIf(node -> node.isTextNode() && node.text().isEmpty());
    return merged;
  }

  private void appendElement(Element element, List<DocMark> marks) {
    String name = JatsElements.name(element);
    switch (name) {
      case "bold", "italic", "strike", "monospace", "code" -> {
        MarkType type = MarkType.fromName(name).orElseThrow();
        appendChildren(element, withMark(marks, DocMark.of(type)));
      }
      case "named-content", "styled-content" -> {
        Optional<String> commentId = commentId(element);
        appendChildren(
            element,
            commentId.map(id -> withMark(marks, DocMark.comment(id))).orElse(marks));
      }
      case "xref" -> appendReference(element, marks);
      case "inline-formula" -> appendText("$" + texOf(element) + "$", marks);
      case "ext-link", "uri" -> appendLink(element, marks);
      case "fn" -> appendText("^[" + JatsElements.text(element) + "]", marks);
      case "break" -> appendText(" ", marks);
      case "inline-graphic", "label" -> {
        // not editable as text
      }
      default -> appendChildren(element, marks);
    }
  }

  private void appendReference(Element xref, List<DocMark> marks) {
    String rid = firstToken(JatsElements.attr(xref, "rid"));
    String refType = JatsElements.attr(xref, "ref-type");
    String label = JatsElements.text(xref);
    if (rid == null) {
      appendText(label, marks);
      return;
    }
    String normalized = RendererIdNormalizer.normalize(rid);

    Optional<StructuredReference> reference =
        "bibr".equals(refType) ? context.reference(rid) : Optional.empty();
    String type;
    String originalKey;
    if (reference.isPresent()) {
      type = NodeTypes.CITATION;
      originalKey = reference.get().key();
    } else if (context.hasFigure(rid) || "fig".equals(refType) || normalized.startsWith("fig-")) {
      type = NodeTypes.FIGURE_REFERENCE;
      originalKey = normalized;
    } else if ("table".equals(refType) || normalized.startsWith("tbl-")) {
      type = NodeTypes.TABLE_REFERENCE;
      originalKey = normalized;
    } else if ("disp-formula".equals(refType) || normalized.startsWith("eq-")) {
      type = NodeTypes.EQUATION_REFERENCE;
      originalKey = normalized;
    } else {
      log.warn("Unresolved cross reference {} (ref-type {}), keeping its text", rid, refType);
      appendText(label, marks);
      return;
    }

    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put(NodeAttrs.RID, rid);
    attrs.put(NodeAttrs.LABEL, label);
    attrs.put(NodeAttrs.ORIGINAL_KEY, originalKey);
    nodes.add(new DocNode(type, attrs, null, null, marks));
  }

  private void appendLink(Element link, List<DocMark> marks) {
    String href = link.getAttributeNS(JatsDocumentParser.XLINK_NS, "href");
    if (href == null || href.isBlank()) {
      href = link.getAttribute("xlink:href");
    }
    String text = JatsElements.text(link);
    if (href == null || href.isBlank() || href.equals(text)) {
      appendText(text, marks);
    } else {
      appendText("[" + text + "](" + href + ")", marks);
    }
  }

  private boolean endsWithSpace() {
    if (nodes.isEmpty()) {
      return true;
    }
    DocNode last = nodes.get(nodes.size() - 1);
    return last.isTextNode() && last.text().endsWith(" ");
  }

  static Optional<String> commentId(Element element) {
    String type = JatsElements.attr(element, "content-type");
    if (type == null) {
      type = JatsElements.attr(element, "style-type");
    }
    if (type == null || !type.toLowerCase(Locale.ROOT).contains(COMMENT_TYPE)) {
      return Optional.empty();
    }
    for (String attribute : COMMENT_ID_ATTRIBUTES) {
      String value = JatsElements.attr(element, attribute);
      if (value != null) {
        return Optional.of(RendererIdNormalizer.normalize(value));
      }
    }
    log.warn("Comment span without an id, dropping the comment mark");
    return Optional.empty();
  }

  static String texOf(Element formula) {
    return JatsElements.descendant(formula, "tex-math")
        .map(tex -> tex.getTextContent().strip())
        .orElseGet(() -> JatsElements.text(formula));
  }

  private static List<DocMark> withMark(List<DocMark> marks, DocMark mark) {
    for (DocMark existing : marks) {
      if (existing.equals(mark)) {
        return marks;
      }
    }
    List<DocMark> result = new ArrayList<>(marks);
    result.add(mark);
    return List.copyOf(result);
  }

  private static String firstToken(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    int space = trimmed.indexOf(' ');
    return space > 0 ? trimmed.substring(0, space) : trimmed;
  }
}
