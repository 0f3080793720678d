package com.flamingo.ai.quartorium.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.quartorium.service.conversion.render.RenderGateway;
import com.flamingo.ai.quartorium.service.conversion.render.RenderKey;
import com.flamingo.ai.quartorium.service.conversion.render.RenderResult;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssetController Tests")
class AssetControllerTest {

  private static final RenderKey KEY = new RenderKey("paper/main.qmd", "v1");
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

  @TempDir Path snapshot;

  @Mock private RenderGateway renderGateway;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() throws Exception {
    Path output = Files.createDirectories(snapshot.resolve("_rendered/main_files"));
    Files.write(output.resolve("plot.png"), PNG);
    mockMvc = MockMvcBuilders.standaloneSetup(new AssetController(renderGateway)).build();
  }

  private RenderResult cachedRender() {
    Path outputDir = snapshot.resolve("_rendered");
    return new RenderResult(
        KEY, "<article/>", snapshot, outputDir, snapshot, outputDir.resolve("main_files"));
  }

  @Test
  @DisplayName("Should serve an asset of a cached render")
  void shouldServeAsset_whenRenderCached() throws Exception {
    when(renderGateway.findCached(KEY)).thenReturn(Optional.of(cachedRender()));

    mockMvc
        .perform(get(URI.create("/api/assets/paper%2Fmain.qmd/v1/main_files/plot.png")))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG))
        .andExpect(content().bytes(PNG));
  }

  @Test
  @DisplayName("Should return 404 for an asset the render did not write")
  void shouldReturnNotFound_whenAssetMissing() throws Exception {
    when(renderGateway.findCached(KEY)).thenReturn(Optional.of(cachedRender()));

    mockMvc
        .perform(get(URI.create("/api/assets/paper%2Fmain.qmd/v1/main_files/other.png")))
        .andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("Should return 404 when the render is no longer cached")
  void shouldReturnNotFound_whenRenderEvicted() throws Exception {
    when(renderGateway.findCached(any(RenderKey.class))).thenReturn(Optional.empty());

    mockMvc
        .perform(get(URI.create("/api/assets/paper%2Fmain.qmd/v0/main_files/plot.png")))
        .andExpect(status().isNotFound());
  }
}
