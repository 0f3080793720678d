package com.flamingo.ai.quartorium.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for loading the editor view of a source document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViewDocumentRequest {

  @NotBlank(message = "Document path is required")
  @Size(max = 1024, message = "Document path must be at most 1024 characters")
  private String path;

  /** Content version, for example a commit id. Derived from the content when absent. */
  @Size(max = 128, message = "Version must be at most 128 characters")
  private String version;
}
