package com.flamingo.ai.quartorium.service.conversion.jats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A bibliography entry parsed from a rendered reference list.
 *
 * @param id normalized reference id, e.g. {@code ref-knuth84}
 * @param key citation key used in the source, e.g. {@code knuth84}
 * @param pages page range {@code fpage–lpage}, or the first page alone
 * @param text flattened display text
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructuredReference(
    String id,
    String key,
    String publicationType,
    List<ReferenceAuthor> authors,
    String title,
    String source,
    String year,
    String volume,
    String issue,
    String pages,
    String doi,
    String uri,
    String text) {

  public StructuredReference {
    authors = authors == null ? List.of() : List.copyOf(authors);
  }
}
