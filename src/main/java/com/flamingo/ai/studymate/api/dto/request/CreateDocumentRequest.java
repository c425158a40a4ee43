package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for ingesting a text document. Either {@code content} or {@code pages} must carry
 * text; speech transcripts and OCR output arrive here as ordinary text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDocumentRequest {

  /** Owning session; null stores a session-less document. */
  private UUID sessionId;

  @NotBlank(message = "Title is required")
  @Size(max = 255, message = "Title must not exceed 255 characters")
  private String title;

  private String content;

  /** Page number (as a string) to page text. */
  private Map<String, String> pages;

  private String language;

  private String sourcePath;

  private Map<String, Object> metadata;
}
