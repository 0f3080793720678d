package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds the affiliation, bibliography, author note and figure tables of a rendered document.
 *
 * <p>Only the main article is scanned. The notebook sub-article repeats the same entries under
 * suffixed ids, which {@link RendererIdNormalizer} maps back onto the main article entries.
 */
@Service
@Slf4j
public class ReferenceContextBuilder {

  public ReferenceContext buildContext(Document renderedDoc) {
    Map<String, String> affiliations = new LinkedHashMap<>();
    Map<String, StructuredReference> references = new LinkedHashMap<>();
    Map<String, String> authorNotes = new LinkedHashMap<>();
    Map<String, String> figures = new LinkedHashMap<>();

    if (renderedDoc != null && renderedDoc.getDocumentElement() != null) {
      collect(
          renderedDoc.getDocumentElement(), false, affiliations, references, authorNotes, figures);
    }

    log.debug(
        "Built reference context: {} affiliations, {} references, {} author notes, {} figures",
        affiliations.size(),
        references.size(),
        authorNotes.size(),
        figures.size());
    return new ReferenceContext(affiliations, references, authorNotes, figures);
  }

  private void collect(
      Element element,
      boolean inAuthorNotes,
      Map<String, String> affiliations,
      Map<String, StructuredReference> references,
      Map<String, String> authorNotes,
      Map<String, String> figures) {
    for (Element child : JatsElements.children(element)) {
      String name = JatsElements.name(child);
      if (name.equals("sub-article")) {
        continue;
      }
      String id = RendererIdNormalizer.normalize(JatsElements.attr(child, "id"));
      if (id != null) {
        switch (name) {
          case "aff" -> affiliations.putIfAbsent(id, affiliationText(child));
          case "ref" -> references.putIfAbsent(id, CitationParser.parse(child));
          case "corresp", "fn" -> {
            if (inAuthorNotes) {
              authorNotes.putIfAbsent(id, JatsElements.text(child));
            }
          }
          case "fig" -> figures.putIfAbsent(id, captionText(child));
          default -> {
            // other ids are not referenced by the editor
          }
        }
      }
      collect(
          child,
          inAuthorNotes || name.equals("author-notes"),
          affiliations,
          references,
          authorNotes,
          figures);
    }
  }

  private static String affiliationText(Element aff) {
    StringBuilder sb = new StringBuilder();
    for (Element child : JatsElements.children(aff)) {
      if (JatsElements.is(child, "label")) {
        continue;
      }
      String text = JatsElements.text(child);
      if (!text.isEmpty()) {
        sb.append(sb.length() > 0 ? ", " : "").append(text);
      }
    }
    return sb.length() > 0 ? sb.toString() : JatsElements.text(aff);
  }

  static String captionText(Element figure) {
    return JatsElements.child(figure, "caption").map(JatsElements::text).orElse("");
  }
}
