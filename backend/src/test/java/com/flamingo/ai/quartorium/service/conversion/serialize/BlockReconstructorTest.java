package com.flamingo.ai.quartorium.service.conversion.serialize;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import com.flamingo.ai.quartorium.service.conversion.render.AssetPathMapper;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeAttrs;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BlockReconstructorTest {

  private BlockReconstructor reconstructor;

  @BeforeEach
  void setUp() {
    reconstructor = new BlockReconstructor(new AssetPathMapper(new QuartoriumConfig()));
  }

  private static DocNode quartoBlock(Object... attrs) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < attrs.length; i += 2) {
      values.put((String) attrs[i], attrs[i + 1]);
    }
    return DocNode.block(NodeTypes.QUARTO_BLOCK, values);
  }

  @Test
  @DisplayName("should rebuild an executable chunk with its label and caption options")
  void shouldRebuildChunk_whenFigureBlock() {
    DocNode block =
        quartoBlock(
            NodeAttrs.BLOCK_KEY, "fig-plot",
            NodeAttrs.LANGUAGE, "r",
            NodeAttrs.CODE, "plot(1:10)",
            NodeAttrs.FIG_ID, "fig-plot",
            NodeAttrs.FIG_CAPTION, "A \"quoted\" plot");

    assertThat(reconstructor.reconstruct(block))
        .isEqualTo(
            "```{r}\n#| label: fig-plot\n#| fig-cap: \"A \\\"quoted\\\" plot\"\nplot(1:10)\n```");
  }

  @Test
  @DisplayName("should omit the label of a block with a positional key")
  void shouldOmitLabel_whenKeySynthetic() {
    DocNode block =
        quartoBlock(
            NodeAttrs.BLOCK_KEY, "__CODE_BLOCK_3__", NodeAttrs.LANGUAGE, "python",
            NodeAttrs.CODE, "x = 1");

    assertThat(reconstructor.reconstruct(block)).isEqualTo("```{python}\nx = 1\n```");
  }

  @Test
  @DisplayName("should use a longer fence when the code contains one")
  void shouldLengthenFence_whenCodeHasFence() {
    DocNode block = quartoBlock(NodeAttrs.LANGUAGE, "markdown", NodeAttrs.CODE, "```\ninner\n```");

    assertThat(reconstructor.reconstruct(block))
        .isEqualTo("````{markdown}\n```\ninner\n```\n````");
  }

  @Test
  @DisplayName("should write a code block as executable only when it carries a block key")
  void shouldMarkExecutable_whenBlockKeyPresent() {
    DocNode cell =
        new DocNode(
            NodeTypes.CODE_BLOCK,
            Map.of(NodeAttrs.LANGUAGE, "python", NodeAttrs.BLOCK_KEY, "fig-x"),
            List.of(DocNode.text("print(1)")),
            null,
            null);
    DocNode listing =
        new DocNode(
            NodeTypes.CODE_BLOCK,
            Map.of(NodeAttrs.LANGUAGE, "bash"),
            List.of(DocNode.text("ls")),
            null,
            null);

    assertThat(reconstructor.reconstruct(cell)).isEqualTo("```{python}\nprint(1)\n```");
    assertThat(reconstructor.reconstruct(listing)).isEqualTo("```bash\nls\n```");
  }

  @Test
  @DisplayName("should append the equation id to a display equation")
  void shouldAppendId_whenEquationLabelled() {
    DocNode block =
        quartoBlock(
            NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_EQUATION,
            NodeAttrs.CODE, "$$ E = mc^2 $$",
            NodeAttrs.FIG_ID, "eq-energy");

    assertThat(reconstructor.reconstruct(block)).isEqualTo("$$ E = mc^2 $$ {#eq-energy}");
  }

  @Test
  @DisplayName("should write a table block as its pipe table")
  void shouldReturnPipeTable_whenTableBlock() {
    DocNode block =
        quartoBlock(NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_TABLE, NodeAttrs.CODE, "| a |\n|---|");

    assertThat(reconstructor.reconstruct(block)).isEqualTo("| a |\n|---|");
  }

  @Test
  @DisplayName("should rewrite frontmatter from the article metadata")
  void shouldWriteYaml_whenMetadataBlock() {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("title", "Paper");
    metadata.put("author", "Ann");

    DocNode block =
        quartoBlock(
            NodeAttrs.LANGUAGE, NodeAttrs.LANGUAGE_METADATA, NodeAttrs.METADATA, metadata);

    assertThat(reconstructor.reconstruct(block)).isEqualTo("---\ntitle: Paper\nauthor: Ann\n---");
    assertThat(reconstructor.frontmatter(Map.of())).isEmpty();
  }

  @Test
  @DisplayName("should turn a figure without code into an image with a local path")
  void shouldWriteImage_whenFigureHasNoCode() {
    DocNode block =
        quartoBlock(
            NodeAttrs.IMAGE_SRC, "/api/assets/proj%2Fdoc.qmd/v1/doc_files/plot%201.png",
            NodeAttrs.FIG_CAPTION, "Plot",
            NodeAttrs.FIG_ID, "fig-plot");

    assertThat(reconstructor.reconstruct(block))
        .isEqualTo("![Plot](doc_files/plot 1.png){#fig-plot}");
  }
}
