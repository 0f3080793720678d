package com.flamingo.ai.quartorium.service.conversion.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scans QMD source and captures the spans that must survive an edit cycle verbatim.
 *
 * <p>A single pass over the lines of the document drives a small state machine:
 *
 * <ul>
 *   <li>{@code ---} at the top of the document opens the YAML frontmatter, the next {@code ---}
 *       closes it;
 *   <li>fenced code blocks are keyed by their chunk label ({@code label="x"}, {@code label=x}, a
 *       {@code fig-}/{@code tbl-}/{@code eq-} bareword, or a {@code #| label: x} option line, which
 *       takes precedence);
 *   <li>pipe tables, with a caption line ({@code : caption} or {@code Table: caption}, optionally
 *       carrying {@code {#tbl-x}}) directly before or after the table or one blank line away;
 *   <li>display equations {@code $$ ... $$} with an optional {@code {#eq-x}} id.
 * </ul>
 *
 * <p>Line terminators are kept as found, so every span is a byte-exact slice of the input. The
 * indexer holds no state between calls.
 */
@Service
@Slf4j
public class BlockIndexer {

  private static final Pattern TABLE_CAPTION_ID = Pattern.compile("\\{#((?:tbl|fig)-[^\\s}]+)}");
  private static final Pattern EQUATION_ID = Pattern.compile("\\{\\s*#((?:eq|eqn)-[^\\s}]+)\\s*}");

  private enum State {
    NONE,
    FRONTMATTER,
    FENCE,
    TABLE,
    EQUATION
  }

  /**
   * Builds the block map of {@code rawText}.
   *
   * @param rawText QMD source, normally with the comments appendix already removed
   * @return ordered map from block key to verbatim span
   */
  public BlockMap indexBlocks(String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return BlockMap.empty();
    }
    List<String> lines = splitLines(rawText);
    BlockMap.Builder builder = new BlockMap.Builder();

    State state = State.NONE;
    StringBuilder span = new StringBuilder();
    boolean seenContent = false;
    CodeFences.FenceMarker fence = null;
    String fenceKey = null;
    boolean fenceRenamed = false;
    // caption line seen before a possible table, with the blank line that followed it
    String pendingCaption = "";
    boolean pendingGap = false;

    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      String trimmed = stripTerminator(line).trim();

      switch (state) {
        case NONE -> {
          String caption = pendingCaption;
          boolean captionGap = pendingGap;
          pendingCaption = "";
          pendingGap = false;
          if (!seenContent && trimmed.equals("---")) {
            span.append(line);
            state = State.FRONTMATTER;
            continue;
          }
          CodeFences.FenceMarker marker = CodeFences.scan(trimmed);
          if (marker != null) {
            span.append(line);
            fence = marker;
            fenceKey = ChunkLabelExtractor.fromFenceHeader(trimmed).orElse(null);
            fenceRenamed = false;
            seenContent = true;
            state = State.FENCE;
            continue;
          }
          if (isTableLine(trimmed)) {
            span.append(caption).append(line);
            seenContent = true;
            state = State.TABLE;
            continue;
          }
          if (trimmed.startsWith("$$")) {
            span.append(line);
            seenContent = true;
            if (trimmed.indexOf("$$", 2) >= 0) {
              addEquation(builder, span);
            } else {
              state = State.EQUATION;
            }
            continue;
          }
          if (isCaptionLine(trimmed)) {
            pendingCaption = line;
          } else if (trimmed.isEmpty() && !caption.isEmpty() && !captionGap) {
            pendingCaption = caption + line;
            pendingGap = true;
          }
          if (!trimmed.isEmpty()) {
            seenContent = true;
          }
        }
        case FRONTMATTER -> {
          span.append(line);
          if (trimmed.equals("---") || trimmed.equals("...")) {
            builder.add(
                BlockMap.FRONTMATTER_KEY, BlockKind.FRONTMATTER, finish(span), "YAML_BLOCK");
            seenContent = true;
            state = State.NONE;
          }
        }
        case FENCE -> {
          span.append(line);
          if (CodeFences.closes(fence, trimmed)) {
            addChunk(builder, span, fenceKey);
            fence = null;
            fenceKey = null;
            state = State.NONE;
          } else if (!fenceRenamed) {
            Optional<String> optionLabel = ChunkLabelExtractor.fromOptionLine(line);
            if (optionLabel.isPresent()) {
              log.debug("Chunk key {} renamed from option line to {}", fenceKey, optionLabel.get());
              fenceKey = optionLabel.get();
              fenceRenamed = true;
            }
          }
        }
        case TABLE -> {
          if (isTableLine(trimmed)) {
            span.append(line);
          } else if (isCaptionLine(trimmed)) {
            span.append(line);
            addTable(builder, span);
            state = State.NONE;
          } else if (trimmed.isEmpty()
              && i + 1 < lines.size()
              && isCaptionLine(stripTerminator(lines.get(i + 1)).trim())) {
            span.append(line).append(lines.get(i + 1));
            i++;
            addTable(builder, span);
            state = State.NONE;
          } else {
            addTable(builder, span);
            state = State.NONE;
            // the current line has not been consumed yet
            i--;
          }
        }
        case EQUATION -> {
          span.append(line);
          if (trimmed.contains("$$")) {
            addEquation(builder, span);
            state = State.NONE;
          }
        }
        default -> throw new IllegalStateException("Unexpected state " + state);
      }
    }

    switch (state) {
      case FRONTMATTER -> {
        log.warn("Unterminated frontmatter; capturing it up to the end of the document");
        builder.add(BlockMap.FRONTMATTER_KEY, BlockKind.FRONTMATTER, finish(span), "YAML_BLOCK");
      }
      case FENCE -> {
        log.warn("Unterminated code fence {}; capturing it up to the end of the file", fenceKey);
        addChunk(builder, span, fenceKey);
      }
      case TABLE -> addTable(builder, span);
      case EQUATION -> {
        log.warn("Unterminated display equation; capturing it up to the end of the document");
        addEquation(builder, span);
      }
      default -> {
        // nothing pending
      }
    }

    if (!builder.duplicates().isEmpty()) {
      log.warn("Duplicate block labels replaced by positional keys: {}", builder.duplicates());
    }
    BlockMap blockMap = builder.build();
    log.debug("Indexed {} blocks: {}", blockMap.size(), blockMap.keys());
    return blockMap;
  }

  private void addChunk(BlockMap.Builder builder, StringBuilder span, String key) {
    builder.add(key, BlockKind.CODE_CHUNK, finish(span), "CODE_BLOCK");
  }

  private void addTable(BlockMap.Builder builder, StringBuilder span) {
    String raw = finish(span);
    Matcher id = TABLE_CAPTION_ID.matcher(raw);
    builder.add(id.find() ? id.group(1) : null, BlockKind.TABLE, raw, "TABLE_BLOCK");
  }

  private void addEquation(BlockMap.Builder builder, StringBuilder span) {
    String raw = finish(span);
    Matcher id = EQUATION_ID.matcher(raw);
    builder.add(id.find() ? id.group(1) : null, BlockKind.EQUATION, raw, "EQ_BLOCK");
  }

  /** Returns the span without its final line terminator and resets the buffer. */
  private static String finish(StringBuilder span) {
    String raw = stripTerminator(span.toString());
    span.setLength(0);
    return raw;
  }

  private static boolean isTableLine(String trimmed) {
    return trimmed.length() >= 2 && trimmed.startsWith("|") && trimmed.endsWith("|");
  }

  /** {@code : text} or {@code Table: text}; fenced div markers ({@code :::}) are not captions. */
  private static boolean isCaptionLine(String trimmed) {
    if (trimmed.startsWith("Table:") || trimmed.startsWith("table:")) {
      return true;
    }
    return trimmed.startsWith(":") && !trimmed.startsWith("::") && trimmed.length() > 1;
  }

  /** Splits text into lines that keep their terminators. */
  static List<String> splitLines(String text) {
    List<String> lines = new ArrayList<>();
    int start = 0;
    int newline;
    while ((newline = text.indexOf('\n', start)) >= 0) {
      lines.add(text.substring(start, newline + 1));
      start = newline + 1;
    }
    if (start < text.length()) {
      lines.add(text.substring(start));
    }
    return lines;
  }

  static String stripTerminator(String line) {
    if (line.endsWith("\r\n")) {
      return line.substring(0, line.length() - 2);
    }
    if (line.endsWith("\n")) {
      return line.substring(0, line.length() - 1);
    }
    return line;
  }
}
