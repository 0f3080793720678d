package com.flamingo.ai.quartorium.service.conversion.comment;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommentAppendixWriterTest {

  private ObjectMapper objectMapper;
  private CommentAppendixWriter writer;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    writer = new CommentAppendixWriter(objectMapper);
  }

  @Test
  @DisplayName("should write the appendix with two-space indented JSON")
  void shouldWriteExactFormat() {
    CommentThread thread =
        CommentThread.builder()
            .id("c-1")
            .author("ann")
            .status(CommentStatus.OPEN)
            .thread(List.of(CommentMessage.builder().text("Check this").author("ann").build()))
            .build();

    String appendix = writer.write(List.of(thread));

    assertThat(appendix)
        .isEqualTo(
            """
            <!-- Comments Appendix -->
            <div id="quartorium-comments" style="display:none;">
            ```json
            {
              "comments": [
                {
                  "id": "c-1",
                  "author": "ann",
                  "status": "open",
                  "thread": [
                    {
                      "text": "Check this",
                      "author": "ann"
                    }
                  ]
                }
              ]
            }
            ```
            </div>""");
  }

  @Test
  @DisplayName("should write empty containers without padding")
  void shouldWriteEmptyThread_whenNoMessages() {
    CommentThread thread = CommentThread.builder().id("c-2").build();

    String appendix = writer.write(List.of(thread));

    assertThat(appendix).contains("\"thread\": []");
  }

  @Test
  @DisplayName("should be read back by the extractor with unknown fields intact")
  void shouldRoundTripThroughExtractor() {
    CommentThread thread = CommentThread.builder().id("c-3").status(CommentStatus.RESOLVED).build();
    thread.setAdditionalProperty("anchorHint", "second paragraph");
    String source = "Text.\n\n" + writer.write(List.of(thread)) + "\n";

    CommentExtraction extraction = new CommentExtractor(objectMapper).extractComments(source);

    assertThat(extraction.remainingText()).isEqualTo("Text.");
    assertThat(extraction.comments()).containsExactly(thread);
  }
}
