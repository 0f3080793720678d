package com.flamingo.ai.quartorium.service.conversion.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.flamingo.ai.quartorium.service.conversion.render.AssetPathMapper;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rebuilds QMD source for blocks whose original span could not be found.
 *
 * <p>The output is valid source but not necessarily identical to what the author wrote: chunk
 * options other than the label and figure caption are lost, and frontmatter is rewritten from the
 * rendered article metadata.
 */
@Component
@Slf4j
public class BlockReconstructor {

  private static final Pattern BACKTICK_RUN = Pattern.compile("(?m)^\\s*(`{3,})");
  private static final Pattern ID_LIKE = Pattern.compile("^(?:fig|tbl|eq|eqn)-\\S+$");

  private final AssetPathMapper assetPathMapper;
  private final YAMLMapper yamlMapper;

  public BlockReconstructor(AssetPathMapper assetPathMapper) {
    this.assetPathMapper = assetPathMapper;
    this.yamlMapper =
        YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();
  }

  /** Rebuilds a {@code quartoBlock} or {@code codeBlock}; empty when there is nothing to write. */
  public String reconstruct(DocNode block) {
    if (block.isType(NodeTypes.CODE_BLOCK)) {
      return codeBlock(block);
    }
    String language = block.stringAttr(NodeAttrs.LANGUAGE);
    if (NodeAttrs.LANGUAGE_METADATA.equals(language)) {
      return frontmatter(block.attr(NodeAttrs.METADATA));
    }
    if (NodeAttrs.LANGUAGE_TABLE.equals(language)) {
      return code(block);
    }
    if (NodeAttrs.LANGUAGE_EQUATION.equals(language)) {
      return equation(block);
    }
    if (code(block).isBlank() && block.stringAttr(NodeAttrs.IMAGE_SRC) != null) {
      return image(block);
    }
    return chunk(block, language);
  }

  String frontmatter(Object metadata) {
    if (!(metadata instanceof Map<?, ?> map) || map.isEmpty()) {
      return "";
    }
    try {
      return "---\n" + yamlMapper.writeValueAsString(map) + "---";
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write frontmatter", e);
    }
  }

  private String chunk(DocNode block, String language) {
    String code = code(block);
    String fence = fenceFor(code);
    StringBuilder sb = new StringBuilder(fence);
    if (language == null) {
      sb.append('\n');
    } else {
      sb.append('{').append(language).append("}\n");
      String label = chunkLabel(block);
      if (label != null) {
        sb.append("#| label: ").append(label).append('\n');
      }
      String caption = block.stringAttr(NodeAttrs.FIG_CAPTION);
      if (caption != null) {
        sb.append("#| fig-cap: \"").append(caption.replace("\"", "\\\"")).append("\"\n");
      }
    }
    if (!code.isEmpty()) {
      sb.append(code).append('\n');
    }
    return sb.append(fence).toString();
  }

  private String codeBlock(DocNode block) {
    String code = block.textContent();
    String language = block.stringAttr(NodeAttrs.LANGUAGE);
    String fence = fenceFor(code);
    StringBuilder sb = new StringBuilder(fence);
    if (language != null) {
      // a block key marks code that came from an executable cell
      boolean executable = block.stringAttr(NodeAttrs.BLOCK_KEY) != null;
      sb.append(executable ? "{" + language + "}" : language);
    }
    sb.append('\n');
    if (!code.isEmpty()) {
      sb.append(code).append('\n');
    }
    return sb.append(fence).toString();
  }

  private String equation(DocNode block) {
    String code = code(block);
    String id = block.stringAttr(NodeAttrs.FIG_ID);
    if (id == null) {
      id = block.stringAttr(NodeAttrs.BLOCK_KEY);
    }
    if (id != null && ID_LIKE.matcher(id).matches() && !code.contains("{#")) {
      return code + " {#" + id + "}";
    }
    return code;
  }

  private String image(DocNode block) {
    String src = block.stringAttr(NodeAttrs.IMAGE_SRC);
    String path =
        assetPathMapper
            .fromUrl(src)
            .map(AssetPathMapper.AssetLocation::relativePath)
            .orElse(src);
    String caption = block.stringAttr(NodeAttrs.FIG_CAPTION);
    String label = chunkLabel(block);
    StringBuilder sb = new StringBuilder("![");
    sb.append(caption == null ? "" : caption).append("](").append(path).append(')');
    if (label != null) {
      sb.append("{#").append(label).append('}');
    }
    return sb.toString();
  }

  /** Label for a rebuilt chunk: the figure id, an id-like figure label, or a non-synthetic key. */
  private static String chunkLabel(DocNode block) {
    String figId = block.stringAttr(NodeAttrs.FIG_ID);
    if (figId != null) {
      return figId;
    }
    String figLabel = block.stringAttr(NodeAttrs.FIG_LABEL);
    if (figLabel != null && ID_LIKE.matcher(figLabel).matches()) {
      return figLabel;
    }
    String blockKey = block.stringAttr(NodeAttrs.BLOCK_KEY);
    if (blockKey != null && !blockKey.startsWith("__")) {
      return blockKey;
    }
    return null;
  }

  private static String code(DocNode block) {
    Object code = block.attr(NodeAttrs.CODE);
    return code == null ? "" : code.toString();
  }

  private static String fenceFor(String code) {
    int longest = 2;
    Matcher matcher = BACKTICK_RUN.matcher(code);
    while (matcher.find()) {
      longest = Math.max(longest, matcher.group(1).length());
    }
    return "`".repeat(longest + 1);
  }
}
