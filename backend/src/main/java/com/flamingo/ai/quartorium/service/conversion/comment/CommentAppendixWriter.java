package com.flamingo.ai.quartorium.service.conversion.comment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Writes comment threads back into the appendix format read by {@link CommentExtractor}. */
@Component
public class CommentAppendixWriter {

  private final ObjectWriter writer;

  public CommentAppendixWriter(ObjectMapper objectMapper) {
    this.writer = objectMapper.writer(new CommentAppendixPrettyPrinter());
  }

  /**
   * Renders the appendix block, without surrounding blank lines.
   *
   * @throws IllegalStateException if the threads cannot be serialized
   */
  public String write(List<CommentThread> comments) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("comments", comments == null ? List.of() : comments);
    String json;
    try {
      json = writer.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize comment threads", e);
    }
    return String.join(
        "\n",
        CommentAppendix.MARKER,
        CommentAppendix.CONTAINER_OPEN,
        CommentAppendix.JSON_FENCE_OPEN,
        json,
        CommentAppendix.JSON_FENCE_CLOSE,
        CommentAppendix.CONTAINER_CLOSE);
  }
}
