package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

/** Parses a {@code ref} element of a rendered reference list into a {@link StructuredReference}. */
final class CitationParser {

  private CitationParser() {}

  static StructuredReference parse(Element ref) {
    String id = RendererIdNormalizer.normalize(JatsElements.attr(ref, "id"));
    String key = RendererIdNormalizer.citationKey(id);

    Optional<Element> descriptor =
        JatsElements.child(ref, "element-citation")
            .or(() -> JatsElements.child(ref, "mixed-citation"));
    if (descriptor.isEmpty()) {
      String text = JatsElements.text(ref);
      return new StructuredReference(
          id, key, null, List.of(), null, null, null, null, null, null, null, null, text);
    }

    Element citation = descriptor.get();
    List<ReferenceAuthor> authors = parseAuthors(citation);
    String title =
        firstText(citation, "article-title", "chapter-title", "data-title", "part-title");
    String source = JatsElements.childText(citation, "source");
    String year = JatsElements.childText(citation, "year");
    String volume = JatsElements.childText(citation, "volume");
    String issue = JatsElements.childText(citation, "issue");
    String pages = pageRange(citation);
    String doi = doi(citation);
    String uri = JatsElements.childText(citation, "uri");

    String text;
    if (JatsElements.is(citation, "mixed-citation")) {
      text = JatsElements.text(citation);
    } else {
      text = displayText(authors, year, title, source, volume, issue, pages, doi, uri);
    }

    return new StructuredReference(
        id,
        key,
        JatsElements.attr(citation, "publication-type"),
        authors,
        title,
        source,
        year,
        volume,
        issue,
        pages,
        doi,
        uri,
        text);
  }

  private static List<ReferenceAuthor> parseAuthors(Element citation) {
    List<ReferenceAuthor> authors = new ArrayList<>();
    List<Element> groups = JatsElements.children(citation, "person-group");
    List<Element> holders = groups.isEmpty() ? List.of(citation) : groups;
    for (Element holder : holders) {
      String groupType = JatsElements.attr(holder, "person-group-type");
      if (groupType != null && !groupType.equals("author")) {
        continue;
      }
      for (Element person : JatsElements.children(holder)) {
        switch (JatsElements.name(person)) {
          case "name" -> authors.add(
              new ReferenceAuthor(
                  JatsElements.childText(person, "surname"),
                  JatsElements.childText(person, "given-names"),
                  null));
          case "string-name", "collab" -> authors.add(
              new ReferenceAuthor(null, null, JatsElements.text(person)));
          default -> {
            // etal and other markers carry no name
          }
        }
      }
    }
    return authors;
  }

  private static String firstText(Element parent, String... names) {
    for (String name : names) {
      String text = JatsElements.childText(parent, name);
      if (text != null) {
        return text;
      }
    }
    return null;
  }

  private static String pageRange(Element citation) {
    String first = JatsElements.childText(citation, "fpage");
    String last = JatsElements.childText(citation, "lpage");
    if (first == null) {
      return JatsElements.childText(citation, "page-range");
    }
    return last == null ? first : first + "–" + last;
  }

  private static String doi(Element citation) {
    for (Element pubId : JatsElements.children(citation, "pub-id")) {
      if ("doi".equalsIgnoreCase(JatsElements.attr(pubId, "pub-id-type"))) {
        return JatsElements.text(pubId);
      }
    }
    return null;
  }

  private static String displayText(
      List<ReferenceAuthor> authors,
      String year,
      String title,
      String source,
      String volume,
      String issue,
      String pages,
      String doi,
      String uri) {
    StringBuilder sb = new StringBuilder();
    if (!authors.isEmpty()) {
      List<String> names = authors.stream().map(ReferenceAuthor::displayName).toList();
      sb.append(String.join("; ", names));
    }
    if (year != null) {
      sb.append(sb.length() > 0 ? " " : "").append('(').append(year).append(").");
    } else if (sb.length() > 0) {
      sb.append('.');
    }
    appendSentence(sb, title);
    if (source != null) {
      sb.append(sb.length() > 0 ? " " : "").append(source);
      if (volume != null) {
        sb.append(", ").append(volume);
        if (issue != null) {
          sb.append('(').append(issue).append(')');
        }
      }
      if (pages != null) {
        sb.append(", ").append(pages);
      }
      sb.append('.');
    }
    if (doi != null) {
      sb.append(sb.length() > 0 ? " " : "").append("https://doi.org/").append(doi);
    } else if (uri != null) {
      sb.append(sb.length() > 0 ? " " : "").append(uri);
    }
    return sb.toString();
  }

  private static void appendSentence(StringBuilder sb, String text) {
    if (text == null) {
      return;
    }
    sb.append(sb.length() > 0 ? " " : "").append(text);
    if (!text.endsWith(".") && !text.endsWith("?") && !text.endsWith("!")) {
      sb.append('.');
    }
  }
}
