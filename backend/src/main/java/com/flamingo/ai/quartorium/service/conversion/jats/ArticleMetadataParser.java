package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Reads the article metadata (title, authors, author notes, abstract, keywords) from {@code
 * front/article-meta}.
 */
final class ArticleMetadataParser {

  private ArticleMetadataParser() {}

  static Map<String, Object> parse(Element article, ReferenceContext context) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    Optional<Element> meta = JatsElements.child(article, "front", "article-meta");
    if (meta.isEmpty()) {
      return metadata;
    }
    Element articleMeta = meta.get();

    JatsElements.child(articleMeta, "title-group", "article-title")
        .map(JatsElements::text)
        .filter(title -> !title.isEmpty())
        .ifPresent(title -> metadata.put("title", title));

    JatsElements.child(articleMeta, "title-group", "subtitle")
        .map(JatsElements::text)
        .filter(subtitle -> !subtitle.isEmpty())
        .ifPresent(subtitle -> metadata.put("subtitle", subtitle));

    List<Map<String, Object>> authors = new ArrayList<>();
    for (Element group : JatsElements.children(articleMeta, "contrib-group")) {
      for (Element contrib : JatsElements.children(group, "contrib")) {
        String type = JatsElements.attr(contrib, "contrib-type");
        if (type == null || type.equals("author")) {
          authors.add(author(contrib, context));
        }
      }
    }
    if (!authors.isEmpty()) {
      metadata.put("authors", authors);
    }

    List<String> notes =
        context.authorNotes().values().stream().filter(note -> !note.isEmpty()).toList();
    if (!notes.isEmpty()) {
      metadata.put("authorNotes", notes);
    }

    JatsElements.child(articleMeta, "abstract")
        .map(JatsElements::text)
        .filter(text -> !text.isEmpty())
        .ifPresent(text -> metadata.put("abstract", text));

    List<String> keywords = new ArrayList<>();
    for (Element group : JatsElements.children(articleMeta, "kwd-group")) {
      for (Element keyword : JatsElements.children(group, "kwd")) {
        String text = JatsElements.text(keyword);
        if (!text.isEmpty()) {
          keywords.add(text);
        }
      }
    }
    if (!keywords.isEmpty()) {
      metadata.put("keywords", keywords);
    }
    return metadata;
  }

  private static Map<String, Object> author(Element contrib, ReferenceContext context) {
    Map<String, Object> author = new LinkedHashMap<>();
    Optional<Element> name = JatsElements.child(contrib, "name");
    String surname = name.map(n -> JatsElements.childText(n, "surname")).orElse(null);
    String givenNames = name.map(n -> JatsElements.childText(n, "given-names")).orElse(null);
    String displayName = JatsElements.childText(contrib, "string-name");
    if (displayName == null) {
      displayName =
          givenNames == null ? surname : surname == null ? givenNames : givenNames + " " + surname;
    }
    putIfPresent(author, "name", displayName);
    putIfPresent(author, "surname", surname);
    putIfPresent(author, "givenNames", givenNames);

    List<String> roles =
        JatsElements.children(contrib, "role").stream()
            .map(JatsElements::text)
            .filter(role -> !role.isEmpty())
            .toList();
    if (!roles.isEmpty()) {
      author.put("roles", roles);
    }

    List<String> affiliations = new ArrayList<>();
    List<String> notes = new ArrayList<>();
    for (Element xref : JatsElements.children(contrib, "xref")) {
      String refType = JatsElements.attr(xref, "ref-type");
      String rid = JatsElements.attr(xref, "rid");
      if ("aff".equals(refType)) {
        context.affiliation(rid).ifPresent(affiliations::add);
      } else if ("corresp".equals(refType) || "author-notes".equals(refType)) {
        context.authorNote(rid).filter(note -> !note.isEmpty()).ifPresent(notes::add);
      }
    }
    if (!affiliations.isEmpty()) {
      author.put("affiliations", affiliations);
    }
    putIfPresent(author, "email", JatsElements.childText(contrib, "email"));
    author.put("corresponding", "yes".equalsIgnoreCase(JatsElements.attr(contrib, "corresp")));
    if (!notes.isEmpty()) {
      author.put("notes", notes);
    }
    return author;
  }

  private static void putIfPresent(Map<String, Object> map, String key, String value) {
    if (value != null && !value.isEmpty()) {
      map.put(key, value);
    }
  }
}
