package com.flamingo.ai.quartorium.service.conversion.comment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.regex.Matcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits the comments appendix off QMD source.
 *
 * <p>The appendix is a hidden HTML container holding a fenced JSON payload of the form {@code
 * {"comments": [...]}}. A malformed payload is logged and ignored, but the appendix is still
 * removed so that it never reaches the renderer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentExtractor {

  private static final TypeReference<List<CommentThread>> THREAD_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  /**
   * Extracts comment threads from {@code rawText}.
   *
   * @param rawText QMD source, possibly carrying a comments appendix
   * @return the threads and the source without its appendix; the text is returned unchanged when
   *     there is no appendix
   */
  public CommentExtraction extractComments(String rawText) {
    if (rawText == null) {
      return new CommentExtraction(List.of(), "");
    }
    Matcher matcher = CommentAppendix.PATTERN.matcher(rawText);
    if (!matcher.find()) {
      return new CommentExtraction(List.of(), rawText);
    }

    String remaining =
        (rawText.substring(0, matcher.start()) + rawText.substring(matcher.end())).strip();
    List<CommentThread> comments = parsePayload(matcher.group(1));
    log.debug("Extracted {} comment threads from appendix", comments.size());
    return new CommentExtraction(comments, remaining);
  }

  private List<CommentThread> parsePayload(String json) {
    try {
      JsonNode root = objectMapper.readTree(json);
      if (root == null) {
        return List.of();
      }
      JsonNode threads = root.isArray() ? root : root.get("comments");
      if (threads == null || threads.isNull()) {
        return List.of();
      }
      if (!threads.isArray()) {
        log.warn("Comments appendix payload has no comment array; ignoring it");
        return List.of();
      }
      List<CommentThread> comments = objectMapper.convertValue(threads, THREAD_LIST);
      return comments.stream().filter(thread -> thread != null && thread.getId() != null).toList();
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Malformed comments appendix, continuing without comments: {}", e.getMessage());
      return List.of();
    }
  }
}
