package com.flamingo.ai.quartorium.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.quartorium.api.dto.request.SerializeDocumentRequest;
import com.flamingo.ai.quartorium.api.dto.request.ViewDocumentRequest;
import com.flamingo.ai.quartorium.exception.ApiError;
import com.flamingo.ai.quartorium.exception.GlobalExceptionHandler;
import com.flamingo.ai.quartorium.exception.ProjectNotFoundException;
import com.flamingo.ai.quartorium.exception.RenderFailureException;
import com.flamingo.ai.quartorium.service.conversion.comment.CommentThread;
import com.flamingo.ai.quartorium.service.conversion.serialize.BlockProvenance;
import com.flamingo.ai.quartorium.service.conversion.serialize.BlockReport;
import com.flamingo.ai.quartorium.service.conversion.serialize.SerializedSource;
import com.flamingo.ai.quartorium.service.conversion.tree.DocNode;
import com.flamingo.ai.quartorium.service.conversion.tree.NodeTypes;
import com.flamingo.ai.quartorium.service.manuscript.DocumentView;
import com.flamingo.ai.quartorium.service.manuscript.ManuscriptService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ManuscriptController Tests")
class ManuscriptControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private ManuscriptService manuscriptService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ManuscriptController(manuscriptService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static DocNode sampleTree() {
    return DocNode.doc(
        Map.of(), List.of(DocNode.heading(1, List.of(DocNode.text("Results")))));
  }

  @Test
  @DisplayName("Should return the editor view of a document")
  void shouldReturnView_whenDocumentRenders() throws Exception {
    DocumentView view =
        new DocumentView(
            "paper/main.qmd",
            "v1",
            sampleTree(),
            List.of(CommentThread.builder().id("c1").author("Ann").build()));
    when(manuscriptService.loadView("paper", "main.qmd", "v1")).thenReturn(view);

    mockMvc
        .perform(
            post("/api/projects/{projectId}/documents/view", "paper")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        ViewDocumentRequest.builder().path("main.qmd").version("v1").build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.documentId").value("paper/main.qmd"))
        .andExpect(jsonPath("$.tree.type").value("doc"))
        .andExpect(jsonPath("$.tree.content[0].attrs.level").value(1))
        .andExpect(jsonPath("$.tree.content[0].content[0].text").value("Results"))
        .andExpect(jsonPath("$.comments[0].id").value("c1"));
  }

  @Test
  @DisplayName("Should reject a view request without a path")
  void shouldReturnBadRequest_whenPathBlank() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/{projectId}/documents/view", "paper")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verifyNoInteractions(manuscriptService);
  }

  @Test
  @DisplayName("Should return 404 for an unknown project")
  void shouldReturnNotFound_whenProjectMissing() throws Exception {
    when(manuscriptService.loadView(eq("ghost"), anyString(), isNull()))
        .thenThrow(new ProjectNotFoundException("ghost"));

    mockMvc
        .perform(
            post("/api/projects/{projectId}/documents/view", "ghost")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"main.qmd\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.PROJECT_NOT_FOUND));
  }

  @Test
  @DisplayName("Should return 502 with renderer diagnostics when rendering fails")
  void shouldReturnBadGateway_whenRenderFails() throws Exception {
    when(manuscriptService.loadView(eq("paper"), anyString(), isNull()))
        .thenThrow(
            new RenderFailureException(
                "paper/main.qmd", "Renderer exited with code 1", "ERROR: unknown format"));

    mockMvc
        .perform(
            post("/api/projects/{projectId}/documents/view", "paper")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"main.qmd\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value(ApiError.RENDER_FAILED))
        .andExpect(jsonPath("$.details").value("ERROR: unknown format"));
  }

  @Test
  @DisplayName("Should serialize an edited tree")
  void shouldReturnSource_whenTreeSerialized() throws Exception {
    SerializedSource serialized =
        new SerializedSource(
            "# Results\n",
            List.of(new BlockReport(0, NodeTypes.HEADING, null, BlockProvenance.PROSE)),
            List.of());
    when(manuscriptService.serialize(any(DocNode.class), eq("# Old\n"), any()))
        .thenReturn(serialized);
    SerializeDocumentRequest request =
        SerializeDocumentRequest.builder().tree(sampleTree()).originalSource("# Old\n").build();

    mockMvc
        .perform(
            post("/api/documents/serialize")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.source").value("# Results\n"))
        .andExpect(jsonPath("$.blocks[0].provenance").value("PROSE"))
        .andExpect(jsonPath("$.reconstructedBlocks").value(0));

    verify(manuscriptService).serialize(sampleTree(), "# Old\n", List.of());
  }

  @Test
  @DisplayName("Should reject a serialize request without a tree")
  void shouldReturnBadRequest_whenTreeMissing() throws Exception {
    mockMvc
        .perform(
            post("/api/documents/serialize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalSource\": \"text\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("Should reject a malformed request body")
  void shouldReturnBadRequest_whenBodyMalformed() throws Exception {
    mockMvc
        .perform(
            post("/api/documents/serialize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tree\": "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Request body could not be read"));
  }
}
