package com.flamingo.ai.studymate.api.dto.response;

import com.flamingo.ai.studymate.domain.entity.Session;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID id;
  private String title;
  private Map<String, Object> metadata;
  private UUID currentDocumentId;
  private Integer currentPage;
  private long documentCount;
  private long turnCount;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime lastAccessedAt;

  public static SessionResponse fromEntity(Session session, long documentCount, long turnCount) {
    return SessionResponse.builder()
        .id(session.getId())
        .title(session.getTitle())
        .metadata(session.getMetadata())
        .currentDocumentId(session.getCurrentDocumentId())
        .currentPage(session.getCurrentPage())
        .documentCount(documentCount)
        .turnCount(turnCount)
        .createdAt(session.getCreatedAt())
        .updatedAt(session.getUpdatedAt())
        .lastAccessedAt(session.getLastAccessedAt())
        .build();
  }
}
