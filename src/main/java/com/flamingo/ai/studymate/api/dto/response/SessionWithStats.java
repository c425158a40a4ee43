package com.flamingo.ai.studymate.api.dto.response;

import com.flamingo.ai.studymate.domain.entity.Session;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Session with its document and conversation-turn counts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionWithStats {
  private Session session;
  private long documentCount;
  private long turnCount;

  public SessionResponse toResponse() {
    return SessionResponse.fromEntity(session, documentCount, turnCount);
  }
}
