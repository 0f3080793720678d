package com.flamingo.ai.quartorium.service.conversion.source;

/** Recognizes Markdown code fence lines (three or more backticks or tildes). */
final class CodeFences {

  static final int FENCE_MIN_LENGTH = 3;

  private CodeFences() {}

  /**
   * Describes a fence marker at the start of a trimmed line.
   *
   * @param character the fence character (backtick or tilde)
   * @param length number of consecutive fence characters
   */
  record FenceMarker(char character, int length) {}

  /** Returns the fence marker that opens {@code trimmedLine}, or null when it is not a fence. */
  static FenceMarker scan(String trimmedLine) {
    if (trimmedLine.isEmpty()) {
      return null;
    }
    char markerChar = trimmedLine.charAt(0);
    if (markerChar != '`' && markerChar != '~') {
      return null;
    }
    int length = 0;
    while (length < trimmedLine.length() && trimmedLine.charAt(length) == markerChar) {
      length++;
    }
    return length >= FENCE_MIN_LENGTH ? new FenceMarker(markerChar, length) : null;
  }

  /** Returns whether {@code trimmedLine} closes a fence opened by {@code opening}. */
  static boolean closes(FenceMarker opening, String trimmedLine) {
    FenceMarker marker = scan(trimmedLine);
    return marker != null
        && marker.character() == opening.character()
        && marker.length() >= opening.length()
        && marker.length() == trimmedLine.length();
  }

  /** Returns whether the line is a bare fence with no info string. */
  static boolean isFenceLine(String trimmedLine) {
    FenceMarker marker = scan(trimmedLine);
    return marker != null && marker.length() == trimmedLine.length();
  }
}
