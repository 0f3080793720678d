package com.flamingo.ai.quartorium.service.conversion.comment;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommentExtractorTest {

  private static final String APPENDIX =
      """
      <!-- Comments Appendix -->
      <div id="quartorium-comments" style="display:none;">
      ```json
      {
        "comments": [
          {
            "id": "c-1",
            "author": "ann",
            "timestamp": "2024-05-01T10:00:00Z",
            "status": "open",
            "thread": [
              {
                "text": "Needs a citation",
                "author": "ann",
                "timestamp": "2024-05-01T10:00:00Z"
              }
            ],
            "anchorHint": "kept"
          }
        ]
      }
      ```
      </div>
      """;

  private CommentExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new CommentExtractor(new ObjectMapper());
  }

  @Test
  @DisplayName("should return the text unchanged when there is no appendix")
  void shouldReturnTextUnchanged_whenNoAppendix() {
    String source = "# Title\n\nSome text.\n";

    CommentExtraction extraction = extractor.extractComments(source);

    assertThat(extraction.comments()).isEmpty();
    assertThat(extraction.remainingText()).isEqualTo(source);
  }

  @Test
  @DisplayName("should parse threads and strip the appendix")
  void shouldExtractThreads_whenAppendixPresent() {
    String source = "# Title\n\nSome [text]{.comment ref=\"c-1\"}.\n\n" + APPENDIX;

    CommentExtraction extraction = extractor.extractComments(source);

    assertThat(extraction.remainingText())
        .isEqualTo("# Title\n\nSome [text]{.comment ref=\"c-1\"}.");
    assertThat(extraction.comments()).hasSize(1);
    CommentThread thread = extraction.comments().get(0);
    assertThat(thread.getId()).isEqualTo("c-1");
    assertThat(thread.getStatus()).isEqualTo(CommentStatus.OPEN);
    assertThat(thread.getThread()).extracting(CommentMessage::getText)
        .containsExactly("Needs a citation");
    assertThat(thread.getAdditionalProperties()).containsEntry("anchorHint", "kept");
  }

  @Test
  @DisplayName("should be idempotent on its own output")
  void shouldBeIdempotent_whenAppliedTwice() {
    String source = "Text.\n\n" + APPENDIX;

    CommentExtraction first = extractor.extractComments(source);
    CommentExtraction second = extractor.extractComments(first.remainingText());

    assertThat(second.remainingText()).isEqualTo(first.remainingText());
    assertThat(second.comments()).isEmpty();
  }

  @Test
  @DisplayName("should drop a malformed appendix without failing")
  void shouldReturnNoComments_whenPayloadMalformed() {
    String source =
        "Body.\n\n<!-- Comments Appendix -->\n"
            + "<div id=\"quartorium-comments\" style=\"display:none;\">\n"
            + "```json\n{\"comments\": [ {\"id\": \n```\n</div>\n";

    CommentExtraction extraction = extractor.extractComments(source);

    assertThat(extraction.comments()).isEmpty();
    assertThat(extraction.remainingText()).isEqualTo("Body.");
  }

  @Test
  @DisplayName("should accept a bare array payload and skip threads without id")
  void shouldAcceptArrayPayload() {
    String source =
        "<!-- Comments Appendix -->\n"
            + "<div id=\"quartorium-comments\" style=\"display:none;\">\n"
            + "```json\n[{\"id\": \"a\", \"status\": \"resolved\"}, {\"author\": \"x\"}]\n"
            + "```\n</div>";

    List<CommentThread> comments = extractor.extractComments(source).comments();

    assertThat(comments).extracting(CommentThread::getId).containsExactly("a");
    assertThat(comments.get(0).getStatus()).isEqualTo(CommentStatus.RESOLVED);
  }

  @Test
  @DisplayName("should treat null input as empty text")
  void shouldReturnEmpty_whenInputNull() {
    CommentExtraction extraction = extractor.extractComments(null);

    assertThat(extraction.comments()).isEmpty();
    assertThat(extraction.remainingText()).isEmpty();
  }
}
