package com.flamingo.ai.quartorium.service.conversion.source;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Extracts chunk labels from code fence headers and {@code #|} option lines. */
final class ChunkLabelExtractor {

  private static final Pattern QUOTED_LABEL = Pattern.compile("label\\s*=\\s*[\"']([^\"']+)[\"']");
  private static final Pattern UNQUOTED_LABEL = Pattern.compile("label\\s*=\\s*([A-Za-z0-9_-]+)");
  private static final Pattern CHUNK_OPTIONS = Pattern.compile("\\{([^}]+)}");
  private static final Pattern OPTION_SEPARATOR = Pattern.compile("[\\s,]+");
  private static final Pattern LABEL_OPTION_LINE =
      Pattern.compile("^\\s*#\\|\\s*label\\s*:\\s*(.+?)\\s*$");
  private static final String[] LABEL_PREFIXES = {"fig-", "tbl-", "eq-"};

  private ChunkLabelExtractor() {}

  /**
   * Looks for a label in a fence header such as {@code ```{r, label="fig-cars"}}, {@code ```{r,
   * label=fig-cars}} or {@code ```{r fig-cars}}, in that order of priority.
   */
  static Optional<String> fromFenceHeader(String header) {
    Matcher quoted = QUOTED_LABEL.matcher(header);
    if (quoted.find()) {
      return nonBlank(quoted.group(1));
    }
    Matcher unquoted = UNQUOTED_LABEL.matcher(header);
    if (unquoted.find()) {
      return nonBlank(unquoted.group(1));
    }
    Matcher options = CHUNK_OPTIONS.matcher(header);
    if (options.find()) {
      for (String part : OPTION_SEPARATOR.split(options.group(1))) {
        for (String prefix : LABEL_PREFIXES) {
          if (part.startsWith(prefix)) {
            return Optional.of(part);
          }
        }
      }
    }
    return Optional.empty();
  }

  /** Reads the value of a {@code #| label: x} line, with surrounding quotes removed. */
  static Optional<String> fromOptionLine(String line) {
    Matcher matcher = LABEL_OPTION_LINE.matcher(line);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return nonBlank(matcher.group(1).replace("\"", "").replace("'", ""));
  }

  private static Optional<String> nonBlank(String value) {
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }
}
