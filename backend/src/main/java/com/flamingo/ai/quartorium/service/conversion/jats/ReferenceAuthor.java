package com.flamingo.ai.quartorium.service.conversion.jats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Author of a bibliography entry. A collaboration only has a {@code literal} name. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferenceAuthor(String surname, String givenNames, String literal) {

  public String displayName() {
    if (surname == null) {
      return literal;
    }
    return givenNames == null ? surname : surname + ", " + givenNames;
  }
}
