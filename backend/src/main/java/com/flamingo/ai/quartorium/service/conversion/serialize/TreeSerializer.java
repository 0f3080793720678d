package com.flamingo.ai.quartorium.service.conversion.serialize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentAppendixWriter;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentExtractor;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.jats.RendererIdNormalizer;
import com.flamingo.ai.quartorium.service.conversion.jats.StructuredReference;
import com.flamingo.ai.quartorium.service.conversion.source.BlockIndexer;
import com.flamingo.ai.quartorium.service.conversion.source.BlockKind;
import com.flamingo.ai.quartorium.service.conversion.source.BlockMap;
import com.flamingo.ai.quartorium.service.conversion.source.SourceBlock;
import com.flamingo.ai.quartorium.service.conversion.tree.DocMark;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.MarkType;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes an edited document tree back to QMD source.
 *
 * <p>Non-prose blocks are copied verbatim from the original source whenever they can be found, by
 * block key first and by content second. Only prose, headings and blocks that can no longer be
 * found are written from the tree. Every fallback to reconstruction is reported on the {@code
 * quartorium.fidelity} logger and in the provenance report of {@link #serializeDetailed}.
 */
@Service
@Slf4j
public class TreeSerializer {

  private static final Logger FIDELITY = LoggerFactory.getLogger("quartorium.fidelity");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TABLE_NOISE = Pattern.compile("[\\s|:\\-]+");
  private static final String LIST_INDENT = "    ";

  private final BlockIndexer blockIndexer;
  private final CommentExtractor commentExtractor;
  private final CommentAppendixWriter appendixWriter;
  private final BlockReconstructor reconstructor;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final InlineSerializer inlineSerializer;
  private final SentenceBreaker sentenceBreaker;
  private final boolean sentenceBreaksEnabled;
  private final boolean pruneOrphanComments;

  public TreeSerializer(
      BlockIndexer blockIndexer,
      CommentExtractor commentExtractor,
      CommentAppendixWriter appendixWriter,
      BlockReconstructor reconstructor,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      QuartoriumConfig config) {
    this.blockIndexer = blockIndexer;
    this.commentExtractor = commentExtractor;
    this.appendixWriter = appendixWriter;
    this.reconstructor = reconstructor;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    QuartoriumConfig.Serializer settings = config.getSerializer();
    this.inlineSerializer = new InlineSerializer(settings.getMarkPrecedence());
    this.sentenceBreaker = new SentenceBreaker(settings.getAbbreviations());
    this.sentenceBreaksEnabled = settings.isSentenceBreaksEnabled();
    this.pruneOrphanComments = settings.isPruneOrphanComments();
  }

  /**
   * Serializes {@code tree} against the source it was produced from.
   *
   * @param tree edited document tree
   * @param rawSourceText original QMD source; a comments appendix in it is ignored
   * @param comments comment threads to write to the appendix
   * @return new QMD source ending with a single newline
   */
  public String serializeTree(DocNode tree, String rawSourceText, List<CommentThread> comments) {
    return serializeDetailed(tree, rawSourceText, comments).text();
  }

  /** Like {@link #serializeTree} and also reports how every block was obtained. */
  @Timed(value = "quartorium.serialize", description = "Time to serialize a tree to QMD")
  public SerializedSource serializeDetailed(
      DocNode tree, String rawSourceText, List<CommentThread> comments) {
    if (tree == null || !tree.isType(NodeTypes.DOC)) {
      throw new IllegalArgumentException("Document tree must have a doc root node");
    }
    String source = commentExtractor.extractComments(rawSourceText).remainingText();
    BlockMap blockMap = blockIndexer.indexBlocks(source);
    ReferenceKeyResolver resolver =
        new ReferenceKeyResolver(citationKeyMap(tree), crossReferenceKeyMap(tree));
    Run run = new Run(blockMap, resolver);

    boolean treeHasFrontmatter =
        tree.content().stream()
            .map(node -> node.stringAttr(NodeAttrs.BLOCK_KEY))
            .anyMatch(BlockMap.FRONTMATTER_KEY::equals);
    Optional<SourceBlock> frontmatter = blockMap.block(BlockMap.FRONTMATTER_KEY);
    if (!treeHasFrontmatter && frontmatter.isPresent()) {
      run.verbatim(NodeTypes.QUARTO_BLOCK, frontmatter.get(), BlockProvenance.PRESERVED);
    }

    for (DocNode node : tree.content()) {
      run.block(node);
    }
    run.reportUnconsumed();

    List<CommentThread> kept = retainedComments(tree, comments);
    if (!kept.isEmpty()) {
      run.parts.add(appendixWriter.write(kept));
    }

    String text = String.join("\n\n", run.parts).stripTrailing() + "\n";
    log.debug(
        "Serialized {} blocks ({} reconstructed), {} comment threads",
        run.reports.size(),
        run.reports.stream().filter(r -> r.provenance() == BlockProvenance.RECONSTRUCTED).count(),
        kept.size());
    return new SerializedSource(text, run.reports, kept);
  }

  @VisibleForTesting
  Map<String, String> citationKeyMap(DocNode tree) {
    Map<String, String> keys = new HashMap<>();
    Object bibliography = tree.attr(NodeAttrs.BIBLIOGRAPHY);
    if (!(bibliography instanceof Map<?, ?> entries)) {
      return keys;
    }
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String id = RendererIdNormalizer.normalize(String.valueOf(entry.getKey()));
      String key = RendererIdNormalizer.citationKey(id);
      try {
        StructuredReference reference =
            objectMapper.convertValue(entry.getValue(), StructuredReference.class);
        if (reference != null && reference.key() != null) {
          key = reference.key();
        }
        if (reference != null && reference.id() != null) {
          keys.putIfAbsent(RendererIdNormalizer.normalize(reference.id()), key);
        }
      } catch (IllegalArgumentException e) {
        log.debug("Bibliography entry {} is not a structured reference: {}", id, e.getMessage());
      }
      keys.put(id, key);
    }
    return keys;
  }

  @VisibleForTesting
  Map<String, String> crossReferenceKeyMap(DocNode tree) {
    Map<String, String> keys = new HashMap<>();
    for (DocNode node : tree.content()) {
      String figId = RendererIdNormalizer.normalize(node.stringAttr(NodeAttrs.FIG_ID));
      if (figId == null) {
        continue;
      }
      String blockKey = node.stringAttr(NodeAttrs.BLOCK_KEY);
      keys.put(figId, blockKey != null && !blockKey.startsWith("__") ? blockKey : figId);
    }
    return keys;
  }

  private List<CommentThread> retainedComments(DocNode tree, List<CommentThread> comments) {
    if (comments == null || comments.isEmpty()) {
      return List.of();
    }
    if (!pruneOrphanComments) {
      return comments;
    }
    Set<String> anchored = new HashSet<>();
    collectCommentIds(tree, anchored);
    List<CommentThread> kept = new ArrayList<>();
    for (CommentThread thread : comments) {
      if (anchored.contains(thread.getId())) {
        kept.add(thread);
      } else {
        log.info("Dropping comment thread {}: its anchor no longer exists", thread.getId());
      }
    }
    return kept;
  }

  private static void collectCommentIds(DocNode node, Set<String> ids) {
    for (DocMark mark : node.marks()) {
      if (MarkType.fromName(mark.type()).orElse(null) == MarkType.COMMENT) {
        String id = mark.attr(NodeAttrs.COMMENT_ID);
        if (id != null) {
          ids.add(id);
        }
      }
    }
    for (DocNode child : node.content()) {
      collectCommentIds(child, ids);
    }
  }

  /** Output and bookkeeping of one serialization. */
  private final class Run {

    private final BlockMap blockMap;
    private final ReferenceKeyResolver resolver;
    private final Set<String> consumed = new LinkedHashSet<>();
    private final List<String> parts = new ArrayList<>();
    private final List<BlockReport> reports = new ArrayList<>();
    private boolean listOpen;

    Run(BlockMap blockMap, ReferenceKeyResolver resolver) {
      this.blockMap = blockMap;
      this.resolver = resolver;
    }

    void block(DocNode node) {
      switch (node.type()) {
        case NodeTypes.PARAGRAPH -> paragraph(node);
        case NodeTypes.HEADING -> heading(node);
        case NodeTypes.QUARTO_BLOCK, NodeTypes.CODE_BLOCK -> sourceBlock(node);
        default -> {
          String text = node.textContent().strip();
          if (!text.isEmpty()) {
            log.warn("Writing unsupported block node {} as a paragraph", node.type());
            emit(text, node, BlockProvenance.PROSE);
          }
        }
      }
    }

    private void paragraph(DocNode node) {
      String text = inlineSerializer.serialize(node.content(), resolver).strip();
      if (text.isEmpty()) {
        return;
      }
      String lines = sentenceBreaksEnabled ? sentenceBreaker.breakLines(text) : text;
      if (node.attr(NodeAttrs.LIST_DEPTH) == null) {
        emit(lines, node, BlockProvenance.PROSE);
      } else {
        listItem(text, lines, node);
      }
    }

    /** Consecutive list items share one part so the list stays tight. */
    private void listItem(String text, String lines, DocNode node) {
      String indent = LIST_INDENT.repeat(Math.max(0, node.intAttr(NodeAttrs.LIST_DEPTH, 0)));
      String continuation = indent + " ".repeat(text.indexOf(' ') + 1);
      String item = indent + lines.replace("\n", "\n" + continuation);
      if (listOpen) {
        int last = parts.size() - 1;
        parts.set(last, parts.get(last) + "\n" + item);
        reports.add(new BlockReport(reports.size(), node.type(), null, BlockProvenance.PROSE));
      } else {
        emit(item, node, BlockProvenance.PROSE);
      }
      listOpen = true;
    }

    private void heading(DocNode node) {
      int level = Math.max(1, Math.min(6, node.intAttr(NodeAttrs.LEVEL, 1)));
      String text = inlineSerializer.serialize(node.content(), resolver).strip();
      emit("#".repeat(level) + " " + text, node, BlockProvenance.PROSE);
    }

    private void sourceBlock(DocNode node) {
      String key = node.stringAttr(NodeAttrs.BLOCK_KEY);
      String language = node.stringAttr(NodeAttrs.LANGUAGE);
      if (BlockMap.BIBLIOGRAPHY_KEY.equals(key)
          || NodeAttrs.LANGUAGE_BIBLIOGRAPHY.equals(language)) {
        return;
      }

      if (key != null && blockMap.containsKey(key) && !consumed.contains(key)) {
        verbatim(node.type(), blockMap.block(key).orElseThrow(), BlockProvenance.PRESERVED);
        return;
      }

      Optional<SourceBlock> match = matchByContent(node);
      if (match.isPresent()) {
        verbatim(node.type(), match.get(), BlockProvenance.MATCHED_BY_CONTENT);
        return;
      }

      String rebuilt = reconstructor.reconstruct(node);
      if (rebuilt.isBlank()) {
        return;
      }
      FIDELITY.warn(
          "Block {} ({}, language {}) not found in source, reconstructed from the tree",
          key,
          node.type(),
          language);
      meterRegistry.counter("quartorium.serializer.reconstructed", "type", node.type()).increment();
      emit(rebuilt, node, BlockProvenance.RECONSTRUCTED);
    }

    void verbatim(String nodeType, SourceBlock block, BlockProvenance provenance) {
      listOpen = false;
      consumed.add(block.key());
      parts.add(block.raw());
      reports.add(new BlockReport(reports.size(), nodeType, block.key(), provenance));
    }

    private void emit(String text, DocNode node, BlockProvenance provenance) {
      listOpen = false;
      parts.add(text);
      reports.add(
          new BlockReport(
              reports.size(), node.type(), node.stringAttr(NodeAttrs.BLOCK_KEY), provenance));
    }

    /** Finds an unconsumed, unlabeled source block of the same kind with the same content. */
    private Optional<SourceBlock> matchByContent(DocNode node) {
      BlockKind kind = kindOf(node);
      String fingerprint = fingerprint(kind, nodeContent(node, kind));
      if (fingerprint.isEmpty()) {
        return Optional.empty();
      }
      for (SourceBlock block : blockMap.blocks()) {
        if (block.synthetic()
            && block.kind() == kind
            && !consumed.contains(block.key())
            && fingerprint.equals(fingerprint(kind, block.body()))) {
          return Optional.of(block);
        }
      }
      return Optional.empty();
    }

    void reportUnconsumed() {
      List<String> dropped =
          blockMap.keys().stream()
              .filter(key -> !consumed.contains(key))
              .filter(key -> !BlockMap.FRONTMATTER_KEY.equals(key))
              .toList();
      if (!dropped.isEmpty()) {
        FIDELITY.warn("Source blocks absent from the edited tree were not written: {}", dropped);
      }
    }
  }

  private static BlockKind kindOf(DocNode node) {
    String language = node.stringAttr(NodeAttrs.LANGUAGE);
    if (NodeAttrs.LANGUAGE_TABLE.equals(language)) {
      return BlockKind.TABLE;
    }
    if (NodeAttrs.LANGUAGE_EQUATION.equals(language)) {
      return BlockKind.EQUATION;
    }
    if (NodeAttrs.LANGUAGE_METADATA.equals(language)) {
      return BlockKind.FRONTMATTER;
    }
    return BlockKind.CODE_CHUNK;
  }

  private static String nodeContent(DocNode node, BlockKind kind) {
    if (node.isType(NodeTypes.CODE_BLOCK)) {
      return node.textContent();
    }
    Object code = node.attr(NodeAttrs.CODE);
    String text = code == null ? "" : code.toString();
    if (kind == BlockKind.EQUATION) {
      String stripped = text.strip();
      if (stripped.startsWith("$$") && stripped.lastIndexOf("$$") > 1) {
        return stripped.substring(2, stripped.lastIndexOf("$$"));
      }
    }
    return text;
  }

  /** Whitespace-insensitive content fingerprint; tables also ignore alignment rows. */
  @VisibleForTesting
  static String fingerprint(BlockKind kind, String content) {
    if (content == null) {
      return "";
    }
    return switch (kind) {
      case TABLE -> {
        StringBuilder rows = new StringBuilder();
        for (String line : content.split("\\R")) {
          if (line.trim().startsWith("|")) {
            rows.append(TABLE_NOISE.matcher(line).replaceAll(""));
          }
        }
        yield rows.toString();
      }
      case CODE_CHUNK -> {
        StringBuilder code = new StringBuilder();
        for (String line : content.split("\\R")) {
          if (!line.trim().startsWith("#|")) {
            code.append(WHITESPACE.matcher(line).replaceAll(""));
          }
        }
        yield code.toString();
      }
      default -> WHITESPACE.matcher(content).replaceAll("");
    };
  }
}
