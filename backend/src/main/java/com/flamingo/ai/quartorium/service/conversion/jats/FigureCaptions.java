package com.flamingo.ai.quartorium.service.conversion.jats;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.w3c.dom.Element;

/** Splits rendered figure captions into their numbering label and caption text. */
final class FigureCaptions {

  private static final Pattern NUMBERED_PREFIX =
      Pattern.compile("^((?:Figure|Table)\\s+\\S+?):\\s*");

  private FigureCaptions() {}

  /**
   * A caption split into its parts.
   *
   * @param label numbering label such as {@code Figure 1}, or null
   * @param caption caption text without the label
   */
  record Split(String label, String caption) {}

  static Split split(Element figure) {
    String explicitLabel = JatsElements.childText(figure, "label");
    String caption = ReferenceContextBuilder.captionText(figure);
    if (explicitLabel != null) {
      return new Split(explicitLabel, caption);
    }
    return split(caption);
  }

  static Split split(String caption) {
    if (caption == null || caption.isEmpty()) {
      return new Split(null, "");
    }
    Matcher matcher = NUMBERED_PREFIX.matcher(caption);
    if (matcher.find()) {
      return new Split(matcher.group(1), caption.substring(matcher.end()));
    }
    return new Split(null, caption);
  }
}
