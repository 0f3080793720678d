package com.flamingo.ai.quartorium.service.conversion.serialize;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Puts every sentence of a serialized paragraph on its own line, so that source diffs stay
 * reviewable sentence by sentence.
 *
 * <p>A boundary is a run of spaces after {@code .}, {@code !} or {@code ?} (optionally followed by
 * closing quotes or brackets) that precedes an uppercase letter or an opening quote, bracket,
 * emphasis or reference marker. No boundary is placed after a known abbreviation, a single-letter
 * initial or an ellipsis, nor inside code spans, math, bracketed spans, URLs or e-mail addresses.
 * The marker of a list item ({@code 1.}, {@code 2)}, {@code -}) is never split from its text.
 */
class SentenceBreaker {

  private static final Pattern PROTECTED =
      Pattern.compile(
          "`+[^`]*`+"
              + "|\\$[^$]+\\$"
              + "|\\[[^\\]]*](?:\\{[^}]*}|\\([^)]*\\))?"
              + "|(?:https?|ftp)://\\S+"
              + "|www\\.\\S+"
              + "|[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)+");

  private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:\\d{1,9}[.)]|[-*+])\\s+");

  private static final String SENTENCE_END = ".!?";
  private static final String CLOSERS = "\"')]”’*_";
  private static final String OPENERS = "\"'([“‘*_@";

  private final Set<String> abbreviations;

  SentenceBreaker(Collection<String> abbreviations) {
    this.abbreviations =
        abbreviations.stream()
            .map(abbreviation -> abbreviation.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }

  String breakLines(String paragraph) {
    if (paragraph == null || paragraph.isEmpty()) {
      return paragraph;
    }
    boolean[] protectedChars = new boolean[paragraph.length()];
    Matcher marker = LIST_MARKER.matcher(paragraph);
    if (marker.find()) {
      for (int i = 0; i < marker.end(); i++) {
        protectedChars[i] = true;
      }
    }
    Matcher matcher = PROTECTED.matcher(paragraph);
    while (matcher.find()) {
      for (int i = matcher.start(); i < matcher.end(); i++) {
        protectedChars[i] = true;
      }
    }

    StringBuilder sb = new StringBuilder(paragraph.length());
    int i = 0;
    while (i < paragraph.length()) {
      char c = paragraph.charAt(i);
      if (c != ' ' || protectedChars[i]) {
        sb.append(c);
        i++;
        continue;
      }
      int end = i;
      while (end < paragraph.length() && paragraph.charAt(end) == ' ') {
        end++;
      }
      if (isBoundary(paragraph, i, end, protectedChars)) {
        sb.append('\n');
      } else {
        sb.append(paragraph, i, end);
      }
      i = end;
    }
    return sb.toString();
  }

  /** Checks the space run {@code [start, end)}. */
  private boolean isBoundary(String text, int start, int end, boolean[] protectedChars) {
    if (start == 0 || end >= text.length()) {
      return false;
    }
    char next = text.charAt(end);
    if (!Character.isUpperCase(next) && OPENERS.indexOf(next) < 0) {
      return false;
    }

    int p = start - 1;
    while (p >= 0 && CLOSERS.indexOf(text.charAt(p)) >= 0) {
      p--;
    }
    if (p < 0 || SENTENCE_END.indexOf(text.charAt(p)) < 0 || protectedChars[p]) {
      return false;
    }

    int wordStart = text.lastIndexOf(' ', p) + 1;
    String word = text.substring(wordStart, p + 1);
    if (word.endsWith("..")) {
      return false;
    }
    if (text.charAt(p) == '.') {
      String bare = stripOpeners(word);
      if (abbreviations.contains(bare.toLowerCase(Locale.ROOT))) {
        return false;
      }
      if (bare.length() == 2 && Character.isUpperCase(bare.charAt(0))) {
        return false;
      }
    }
    return true;
  }

  private static String stripOpeners(String word) {
    int i = 0;
    while (i < word.length() && OPENERS.indexOf(word.charAt(i)) >= 0) {
      i++;
    }
    return word.substring(i);
  }
}
