package com.flamingo.ai.quartorium.service.conversion.jats;

import com.flamingo.ai.quartorium.exception.MalformedSourceException;
import com.flamingo.ai.quartorium.service.conversion.render.AssetBaseRef;
import com.flamingo.ai.quartorium.service.conversion.source.BlockMap;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Transforms rendered JATS into the editor document tree.
 *
 * <p>The body of the notebook sub-article is preferred over the main article body because only the
 * notebook keeps the code of executable cells. Sections become headings followed by their content,
 * executable cells and figures become atomic {@code quartoBlock} nodes, and prose becomes
 * paragraphs whose inline content is built by {@link InlineContentBuilder}.
 */
@Service
@Slf4j
public class TreeTransformer {

  private static final String NOTEBOOK_ARTICLE_TYPE = "notebook";
  private static final String NOTEBOOK_CONTENT = "notebook-content";

  /** Elements that end the current paragraph when they occur inside one. */
  private static final Set<String> BLOCKS_IN_PARAGRAPH =
      Set.of("disp-formula", "fig", "table-wrap", "list", "preformat", "boxed-text");

  /** Elements whose content is transformed as if it were part of the parent container. */
  private static final Set<String> TRANSPARENT_CONTAINERS =
      Set.of("fig-group", "boxed-text", "disp-quote", "app", "app-group", "alternatives");

  /** Elements with no counterpart in the editor. */
  private static final Set<String> SKIPPED =
      Set.of("title", "label", "caption", "ref-list", "fn-group", "sec-meta", "object-id");

  public DocNode buildTree(Document renderedDoc, ReferenceContext context, AssetBaseRef assets) {
    return buildTree(renderedDoc, context, assets, 1);
  }

  /**
   * Builds the document tree.
   *
   * @param renderedDoc parsed JATS
   * @param context lookup tables built from the same document
   * @param assets base under which relative image references are served
   * @param baseHeadingLevel heading level of top-level sections, normally the smallest ATX heading
   *     level used in the source
   * @throws MalformedSourceException if the document has no body
   */
  @Timed(value = "quartorium.transform", description = "Time to transform JATS into a tree")
  public DocNode buildTree(
      Document renderedDoc, ReferenceContext context, AssetBaseRef assets, int baseHeadingLevel) {
    if (renderedDoc == null || renderedDoc.getDocumentElement() == null) {
      throw new MalformedSourceException("Rendered document is empty");
    }
    ReferenceContext lookups = context == null ? ReferenceContext.empty() : context;
    Element article = renderedDoc.getDocumentElement();
    Element body =
        notebookBody(article)
            .or(() -> JatsElements.child(article, "body"))
            .orElseThrow(() -> new MalformedSourceException("Rendered document has no body"));

    Transformation transformation =
        new Transformation(lookups, assets, Math.max(1, Math.min(6, baseHeadingLevel)));
    List<DocNode> content = new ArrayList<>();

    Map<String, Object> metadata = ArticleMetadataParser.parse(article, lookups);
    if (!metadata.isEmpty()) {
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put(NodeAttrs.BLOCK_KEY, BlockMap.FRONTMATTER_KEY);
      attrs.put(NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_METADATA);
      attrs.put(NodeAttrs.METADATA, metadata);
      content.add(DocNode.block(NodeTypes.QUARTO_BLOCK, attrs));
    }

    transformation.blocks(body, 0, content);

    if (!lookups.references().isEmpty()) {
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put(NodeAttrs.BLOCK_KEY, BlockMap.BIBLIOGRAPHY_KEY);
      attrs.put(NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_BIBLIOGRAPHY);
      content.add(DocNode.block(NodeTypes.QUARTO_BLOCK, attrs));
    }

    Map<String, Object> docAttrs = new LinkedHashMap<>();
    docAttrs.put(NodeAttrs.METADATA, metadata);
    docAttrs.put(NodeAttrs.BIBLIOGRAPHY, new LinkedHashMap<>(lookups.references()));
    log.debug(
        "Built document tree with {} blocks from {} body",
        content.size(),
        body.getParentNode() == article ? "article" : "notebook");
    return DocNode.doc(docAttrs, content);
  }

  private static Optional<Element> notebookBody(Element article) {
    for (Element sub : JatsElements.children(article, "sub-article")) {
      if (NOTEBOOK_ARTICLE_TYPE.equals(JatsElements.attr(sub, "article-type"))) {
        Optional<Element> body = JatsElements.child(sub, "body");
        if (body.isPresent()) {
          return body;
        }
      }
    }
    return Optional.empty();
  }

  /** State of one transformation. */
  private static final class Transformation {

    private final ReferenceContext context;
    private final AssetBaseRef assets;
    private final int baseHeadingLevel;

    Transformation(ReferenceContext context, AssetBaseRef assets, int baseHeadingLevel) {
      this.context = context;
      this.assets = assets;
      this.baseHeadingLevel = baseHeadingLevel;
    }

    void blocks(Element container, int depth, List<DocNode> out) {
      for (Element child : JatsElements.children(container)) {
        block(child, depth, out);
      }
    }

    private void block(Element element, int depth, List<DocNode> out) {
      String name = JatsElements.name(element);
      if (SKIPPED.contains(name)) {
        return;
      }
      switch (name) {
        case "sec" -> {
          if (NOTEBOOK_CONTENT.equals(JatsElements.attr(element, "specific-use"))) {
            cell(element, out);
          } else {
            section(element, depth + 1, out);
          }
        }
        case "p" -> paragraph(element, out);
        case "fig" -> out.add(figure(element, null, "", null, null));
        case "table-wrap" -> out.add(table(element));
        case "disp-formula" -> out.add(equation(element));
        case "list" -> list(element, 0, out);
        case "preformat", "code" -> out.add(codeBlock(element, null));
        default -> {
          if (TRANSPARENT_CONTAINERS.contains(name)) {
            blocks(element, depth, out);
          } else {
            degrade(element, out);
          }
        }
      }
    }

    private void section(Element sec, int depth, List<DocNode> out) {
      Optional<Element> title = JatsElements.child(sec, "title");
      if (title.isPresent()) {
        InlineContentBuilder heading = new InlineContentBuilder(context);
        heading.appendChildren(title.get(), List.of());
        List<DocNode> content = heading.drain();
        if (!content.isEmpty()) {
          int level = Math.min(6, baseHeadingLevel + depth - 1);
          out.add(DocNode.heading(level, content));
        }
      }
      blocks(sec, depth, out);
    }

    private void paragraph(Element p, List<DocNode> out) {
      InlineContentBuilder inline = new InlineContentBuilder(context);
      NodeList children = p.getChildNodes();
      for (int i = 0; i < children.getLength(); i++) {
        Node child = children.item(i);
        String name = child.getNodeType() == Node.ELEMENT_NODE ? JatsElements.name(child) : "";
        if (BLOCKS_IN_PARAGRAPH.contains(name)) {
          flush(inline, out);
          block((Element) child, 0, out);
        } else {
          inline.append(child, List.of());
        }
      }
      flush(inline, out);
    }

    private void cell(Element sec, List<DocNode> out) {
      Optional<Element> codeElement = JatsElements.descendant(sec, "code");
      String code =
          codeElement
              .map(Element::getTextContent)
              .map(TreeTransformer::stripFinalNewline)
              .orElse("");
      String language =
          codeElement.map(element -> JatsElements.attr(element, "language"))
              .map(TreeTransformer::firstWord)
              .orElse(null);
      Optional<Element> figure = JatsElements.descendant(sec, "fig");
      String blockKey = RendererIdNormalizer.cellLabel(JatsElements.attr(sec, "id"));
      if (blockKey == null && figure.isPresent()) {
        blockKey = RendererIdNormalizer.normalize(JatsElements.attr(figure.get(), "id"));
      }

      if (figure.isPresent()) {
        out.add(figure(figure.get(), language, code, blockKey, textOutput(sec)));
      } else if (!code.isBlank()) {
        out.add(codeBlock(code, language, blockKey));
      } else {
        log.debug("Skipping executable cell {} without code or figure", blockKey);
      }
    }

    private DocNode figure(
        Element fig, String language, String code, String blockKey, String htmlOutput) {
      String figId = RendererIdNormalizer.normalize(JatsElements.attr(fig, "id"));
      FigureCaptions.Split caption = FigureCaptions.split(fig);
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put(NodeAttrs.BLOCK_KEY, blockKey != null ? blockKey : figId);
      attrs.put(NodeAttrs.LANGUAGE, language);
      attrs.put(NodeAttrs.CODE, code);
      attrs.put(NodeAttrs.FIG_ID, figId);
      attrs.put(NodeAttrs.FIG_LABEL, caption.label());
      attrs.put(NodeAttrs.FIG_CAPTION, caption.caption());
      attrs.put(NodeAttrs.IMAGE_SRC, imageSource(fig));
      attrs.put(NodeAttrs.HTML_OUTPUT, htmlOutput);
      return DocNode.block(NodeTypes.QUARTO_BLOCK, attrs);
    }

    private DocNode table(Element tableWrap) {
      String id = RendererIdNormalizer.normalize(JatsElements.attr(tableWrap, "id"));
      FigureCaptions.Split caption = FigureCaptions.split(tableWrap);
      StringBuilder code = new StringBuilder(PipeTables.render(tableWrap));
      if (!caption.caption().isEmpty() || id != null) {
        code.append("\n\n: ").append(caption.caption());
        if (id != null) {
          code.append(caption.caption().isEmpty() ? "" : " ").append("{#").append(id).append('}');
        }
      }
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put(NodeAttrs.BLOCK_KEY, id);
      attrs.put(NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_TABLE);
      attrs.put(NodeAttrs.CODE, code.toString());
      attrs.put(NodeAttrs.FIG_ID, id);
      attrs.put(NodeAttrs.FIG_LABEL, caption.label());
      attrs.put(NodeAttrs.FIG_CAPTION, caption.caption());
      return DocNode.block(NodeTypes.QUARTO_BLOCK, attrs);
    }

    private DocNode equation(Element formula) {
      String id = RendererIdNormalizer.normalize(JatsElements.attr(formula, "id"));
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put(NodeAttrs.BLOCK_KEY, id);
      attrs.put(NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_EQUATION);
      attrs.put(NodeAttrs.CODE, "$$\n" + InlineContentBuilder.texOf(formula) + "\n$$");
      attrs.put(NodeAttrs.FIG_ID, id);
      return DocNode.block(NodeTypes.QUARTO_BLOCK, attrs);
    }

    /** Items become paragraphs that start with their marker and record their nesting depth. */
    private void list(Element list, int listDepth, List<DocNode> out) {
      boolean ordered = "order".equals(JatsElements.attr(list, "list-type"));
      int index = 1;
      for (Element item : JatsElements.children(list, "list-item")) {
        String marker = ordered ? index++ + ". " : "- ";
        InlineContentBuilder inline = new InlineContentBuilder(context);
        inline.appendText(marker, List.of());
        List<DocNode> nested = new ArrayList<>();
        for (Element child : JatsElements.children(item)) {
          if (JatsElements.is(child, "p") && nested.isEmpty()) {
            inline.appendChildren(child, List.of());
            inline.appendText(" ", List.of());
          } else if (JatsElements.is(child, "list")) {
            list(child, listDepth + 1, nested);
          } else {
            block(child, 0, nested);
          }
        }
        List<DocNode> content = inline.drain();
        if (!content.isEmpty()) {
          out.add(DocNode.paragraph(content).withAttr(NodeAttrs.LIST_DEPTH, listDepth));
        }
        out.addAll(nested);
      }
    }

    private DocNode codeBlock(Element element, String blockKey) {
      String language = firstWord(JatsElements.attr(element, "language"));
      return codeBlock(stripFinalNewline(element.getTextContent()), language, blockKey);
    }

    private DocNode codeBlock(String code, String language, String blockKey) {
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put(NodeAttrs.LANGUAGE, language);
      attrs.put(NodeAttrs.BLOCK_KEY, blockKey);
      List<DocNode> content = code.isEmpty() ? List.of() : List.of(DocNode.text(code));
      return new DocNode(NodeTypes.CODE_BLOCK, attrs, content, null, null);
    }

    /** Falls back to the flattened text of an element the editor has no node for. */
    private void degrade(Element element, List<DocNode> out) {
      InlineContentBuilder inline = new InlineContentBuilder(context);
      inline.appendChildren(element, List.of());
      List<DocNode> content = inline.drain();
      if (!content.isEmpty()) {
        log.debug("Flattening unsupported <{}> into a paragraph", JatsElements.name(element));
        out.add(DocNode.paragraph(content));
      }
    }

    private String imageSource(Element fig) {
      Optional<Element> graphic = JatsElements.descendant(fig, "graphic");
      if (graphic.isEmpty()) {
        return null;
      }
      String href = graphic.get().getAttributeNS(JatsDocumentParser.XLINK_NS, "href");
      if (href == null || href.isBlank()) {
        href = graphic.get().getAttribute("xlink:href");
      }
      if (href == null || href.isBlank()) {
        return null;
      }
      return assets == null ? href : assets.resolve(href);
    }

    /** Plain text outputs of a cell, as escaped {@code pre} blocks. */
    private static String textOutput(Element cell) {
      StringBuilder html = new StringBuilder();
      collectOutputs(cell, html);
      return html.length() == 0 ? null : html.toString();
    }

    private static void collectOutputs(Element element, StringBuilder html) {
      for (Element child : JatsElements.children(element)) {
        if (JatsElements.is(child, "preformat")) {
          html.append("<pre>").append(escapeHtml(child.getTextContent())).append("</pre>");
        } else if (!JatsElements.is(child, "fig") && !JatsElements.is(child, "code")) {
          collectOutputs(child, html);
        }
      }
    }

    private static void flush(InlineContentBuilder inline, List<DocNode> out) {
      List<DocNode> content = inline.drain();
      if (!content.isEmpty()) {
        out.add(DocNode.paragraph(content));
      }
    }
  }

  static String firstWord(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim().split("\\s+")[0];
  }

  static String stripFinalNewline(String text) {
    if (text == null) {
      return "";
    }
    String result = text;
    while (result.endsWith("\n") || result.endsWith("\r")) {
      result = result.substring(0, result.length() - 1);
    }
    while (result.startsWith("\n")) {
      result = result.substring(1);
    }
    return result;
  }

  static String escapeHtml(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
