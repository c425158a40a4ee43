package com.flamingo.ai.studymate.service.session;

import com.flamingo.ai.studymate.api.dto.request.CreateSessionRequest;
import com.flamingo.ai.studymate.api.dto.response.SessionWithStats;
import com.flamingo.ai.studymate.domain.entity.Session;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Service interface for conversation sessions. Sessions are never deleted. */
public interface SessionService {

  /**
   * Creates a new session.
   *
   * @param request title and initial metadata, both optional
   * @return the created session
   */
  Session createSession(CreateSessionRequest request);

  /**
   * Gets a session by ID.
   *
   * @throws com.flamingo.ai.studymate.exception.SessionNotFoundException if not found
   */
  Session getSession(UUID sessionId);

  /** All sessions, most recently accessed first. */
  List<Session> getAllSessions();

  /**
   * Applies a metadata patch. Keys mapped to null are removed; other keys are added or replaced.
   */
  Session patchMetadata(UUID sessionId, Map<String, Object> patch);

  Session touchSession(UUID sessionId);

  SessionWithStats getSessionWithStats(UUID sessionId);

  List<SessionWithStats> getAllSessionsWithStats();
}
