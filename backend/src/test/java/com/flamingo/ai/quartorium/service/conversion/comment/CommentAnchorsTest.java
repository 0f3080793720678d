package com.flamingo.ai.quartorium.service.conversion.comment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommentAnchorsTest {

  private CommentAnchors anchors;

  @BeforeEach
  void setUp() {
    anchors = new CommentAnchors();
  }

  @Test
  @DisplayName("should add the attributes the JATS writer keeps to each comment anchor")
  void shouldAnnotateAnchors() {
    String source = "A [first]{.comment ref=\"c1\"} and [second]{.comment ref='c2'} note.\n";

    assertThat(anchors.annotateForRender(source))
        .isEqualTo(
            "A [first]{.comment ref=\"c1\" content-type=\"comment\" rid=\"c1\"} and "
                + "[second]{.comment ref='c2' content-type=\"comment\" rid=\"c2\"} note.\n");
  }

  @Test
  @DisplayName("should leave other spans, annotated anchors and fenced code alone")
  void shouldNotAnnotate_whenNotAPlainAnchor() {
    String source =
        "A [span]{.commentary ref=\"x\"} here.\n\n"
            + "[done]{.comment ref=\"c1\" content-type=\"comment\" rid=\"c1\"}\n\n"
            + "```markdown\n[kept]{.comment ref=\"c9\"}\n```\n";

    assertThat(anchors.annotateForRender(source)).isEqualTo(source);
  }

  @Test
  @DisplayName("should keep an anchor without a ref unchanged")
  void shouldNotAnnotate_whenRefMissing() {
    assertThat(anchors.annotateForRender("[x]{.comment}\n")).isEqualTo("[x]{.comment}\n");
    assertThat(anchors.annotateForRender(null)).isNull();
  }
}
