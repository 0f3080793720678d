package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables of a rendered document, keyed by normalized element id.
 *
 * @param affiliations affiliation id to display text
 * @param references reference id to parsed bibliography entry
 * @param authorNotes author note id to text
 * @param figures figure id to flattened caption
 */
public record ReferenceContext(
    Map<String, String> affiliations,
    Map<String, StructuredReference> references,
    Map<String, String> authorNotes,
    Map<String, String> figures) {

  public ReferenceContext {
    affiliations = copy(affiliations);
    references = copy(references);
    authorNotes = copy(authorNotes);
    figures = copy(figures);
  }

  public static ReferenceContext empty() {
    return new ReferenceContext(null, null, null, null);
  }

  public Optional<String> affiliation(String rid) {
    return Optional.ofNullable(affiliations.get(RendererIdNormalizer.normalize(rid)));
  }

  public Optional<StructuredReference> reference(String rid) {
    return Optional.ofNullable(references.get(RendererIdNormalizer.normalize(rid)));
  }

  public Optional<String> authorNote(String rid) {
    return Optional.ofNullable(authorNotes.get(RendererIdNormalizer.normalize(rid)));
  }

  public boolean hasFigure(String rid) {
    return rid != null && figures.containsKey(RendererIdNormalizer.normalize(rid));
  }

  private static <V> Map<String, V> copy(Map<String, V> source) {
    return source == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
