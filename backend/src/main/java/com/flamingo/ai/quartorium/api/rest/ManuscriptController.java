package com.flamingo.ai.quartorium.api.rest;

import com.flamingo.ai.quartorium.api.dto.request.SerializeDocumentRequest;
import com.flamingo.ai.quartorium.api.dto.request.ViewDocumentRequest;
import com.flamingo.ai.quartorium.api.dto.response.DocumentViewResponse;
import com.flamingo.ai.quartorium.api.dto.response.SerializedDocumentResponse;
import com.flamingo.ai.quartorium.service.conversion.serialize.SerializedSource;
import com.flamingo.ai.quartorium.service.manuscript.DocumentView;
import com.flamingo.ai.quartorium.service.manuscript.ManuscriptService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the manuscript edit cycle. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ManuscriptController {

  private final ManuscriptService manuscriptService;

  /** Renders a source document and returns its editor view. */
  @PostMapping("/projects/{projectId}/documents/view")
  public ResponseEntity<DocumentViewResponse> viewDocument(
      @PathVariable String projectId, @Valid @RequestBody ViewDocumentRequest request) {
    DocumentView view =
        manuscriptService.loadView(projectId, request.getPath(), request.getVersion());
    return ResponseEntity.ok(DocumentViewResponse.fromView(view));
  }

  /** Serializes an edited tree against its original source. */
  @PostMapping("/documents/serialize")
  public ResponseEntity<SerializedDocumentResponse> serializeDocument(
      @Valid @RequestBody SerializeDocumentRequest request) {
    SerializedSource serialized =
        manuscriptService.serialize(
            request.getTree(), request.getOriginalSource(), request.getComments());
    return ResponseEntity.ok(SerializedDocumentResponse.fromSerialized(serialized));
  }
}
