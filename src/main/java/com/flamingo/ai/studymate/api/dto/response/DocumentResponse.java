package com.flamingo.ai.studymate.api.dto.response;

import com.flamingo.ai.studymate.domain.entity.Document;
import com.flamingo.ai.studymate.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. Page text is not included; it is served by open_doc. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private UUID sessionId;
  private String title;
  private String language;
  private String sourcePath;
  private int totalPages;
  private Map<String, Object> metadata;
  private DocumentStatus status;
  private Integer chunkCount;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime indexedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .sessionId(document.getSession() != null ? document.getSession().getId() : null)
        .title(document.getTitle())
        .language(document.getLanguage())
        .sourcePath(document.getSourcePath())
        .totalPages(document.maxPageNumber().orElse(0))
        .metadata(document.getMetadata())
        .status(document.getStatus())
        .chunkCount(document.getChunkCount())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .indexedAt(document.getIndexedAt())
        .build();
  }
}
