package com.flamingo.ai.quartorium.service.conversion.comment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle state of a comment thread. */
public enum CommentStatus {
  OPEN("open"),
  RESOLVED("resolved");

  private final String value;

  CommentStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Unknown values are read as {@link #OPEN} so that one odd thread does not void the appendix. */
  @JsonCreator
  public static CommentStatus fromValue(String value) {
    return "resolved".equalsIgnoreCase(value) ? RESOLVED : OPEN;
  }
}
