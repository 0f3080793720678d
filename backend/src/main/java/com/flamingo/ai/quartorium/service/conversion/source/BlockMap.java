package com.flamingo.ai.quartorium.service.conversion.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered map from block key to the verbatim source span of a non-prose block.
 *
 * <p>Keys are unique. Iteration follows source order, so concatenating the spans reproduces the
 * non-prose content of the document.
 */
public final class BlockMap {

  /** Reserved key of the YAML frontmatter block. */
  public static final String FRONTMATTER_KEY = "__YAML_BLOCK__";

  /** Reserved key marking the derived bibliography, which is never written back to source. */
  public static final String BIBLIOGRAPHY_KEY = "__BIBLIOGRAPHY__";

  private static final BlockMap EMPTY = new BlockMap(Map.of());

  private final Map<String, SourceBlock> blocks;

  private BlockMap(Map<String, SourceBlock> blocks) {
    this.blocks = blocks;
  }

  public static BlockMap empty() {
    return EMPTY;
  }

  /** Returns the raw source text stored under {@code key}, or null. */
  public String get(String key) {
    SourceBlock block = key == null ? null : blocks.get(key);
    return block == null ? null : block.raw();
  }

  public Optional<SourceBlock> block(String key) {
    return Optional.ofNullable(key == null ? null : blocks.get(key));
  }

  public boolean containsKey(String key) {
    return key != null && blocks.containsKey(key);
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(blocks.keySet());
  }

  public List<SourceBlock> blocks() {
    return List.copyOf(blocks.values());
  }

  public int size() {
    return blocks.size();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  /** Returns a view keyed by block key with the raw text as value. */
  public Map<String, String> asRawMap() {
    Map<String, String> raw = new LinkedHashMap<>();
    blocks.forEach((key, block) -> raw.put(key, block.raw()));
    return raw;
  }

  @Override
  public String toString() {
    return "BlockMap" + blocks.keySet();
  }

  /** Accumulates blocks in source order while guaranteeing key uniqueness. */
  static final class Builder {

    private final Map<String, SourceBlock> blocks = new LinkedHashMap<>();
    private final List<String> duplicates = new ArrayList<>();

    /**
     * Adds a block. A missing or already used key is replaced by a synthetic positional key built
     * from {@code syntheticPrefix}.
     *
     * @return the key the block was stored under
     */
    String add(String preferredKey, BlockKind kind, String raw, String syntheticPrefix) {
      boolean synthetic = preferredKey == null;
      String key = preferredKey;
      if (key != null && blocks.containsKey(key)) {
        duplicates.add(key);
        key = null;
        synthetic = true;
      }
      if (key == null) {
        int position = blocks.size();
        key = "__" + syntheticPrefix + "_" + position + "__";
        while (blocks.containsKey(key)) {
          position++;
          key = "__" + syntheticPrefix + "_" + position + "__";
        }
      }
      blocks.put(key, new SourceBlock(key, kind, raw, synthetic));
      return key;
    }

    List<String> duplicates() {
      return duplicates;
    }

    BlockMap build() {
      return blocks.isEmpty()
          ? EMPTY
          : new BlockMap(Collections.unmodifiableMap(new LinkedHashMap<>(blocks)));
    }
  }
}
