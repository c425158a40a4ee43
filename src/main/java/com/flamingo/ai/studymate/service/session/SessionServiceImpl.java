package com.flamingo.ai.studymate.service.session;

import com.flamingo.ai.studymate.api.dto.request.CreateSessionRequest;
import com.flamingo.ai.studymate.api.dto.response.SessionWithStats;
import com.flamingo.ai.studymate.domain.entity.Session;
import com.flamingo.ai.studymate.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.studymate.domain.repository.DocumentRepository;
import com.flamingo.ai.studymate.domain.repository.SessionRepository;
import com.flamingo.ai.studymate.exception.SessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class SessionServiceImpl implements SessionService {

  private final SessionRepository sessionRepository;
  private final DocumentRepository documentRepository;
  private final ConversationTurnRepository conversationTurnRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "session.create", description = "Time to create a session")
  public Session createSession(CreateSessionRequest request) {
    Session session = Session.builder().build();
    if (request != null && request.getTitle() != null && !request.getTitle().isBlank()) {
      session.setTitle(request.getTitle());
    }
    if (request != null && request.getMetadata() != null) {
      session.patchMetadata(request.getMetadata());
    }

    Session saved = sessionRepository.save(session);
    meterRegistry.counter("session.created").increment();

    log.info("Created session with ID: {}", saved.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.get", description = "Time to get a session")
  public Session getSession(UUID sessionId) {
    return sessionRepository
        .findById(sessionId)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.getAll", description = "Time to get all sessions")
  public List<Session> getAllSessions() {
    return sessionRepository.findAllByOrderByLastAccessedAtDesc();
  }

  @Override
  @Transactional
  @Timed(value = "session.patchMetadata", description = "Time to patch session metadata")
  public Session patchMetadata(UUID sessionId, Map<String, Object> patch) {
    Session session = getSession(sessionId);
    // copy so Hibernate sees a new value for the converted column
    session.setMetadata(new HashMap<>(session.getMetadata()));
    session.patchMetadata(patch);
    session.touch();

    log.debug("Patched metadata of session {} with keys {}", sessionId, patch.keySet());
    return sessionRepository.save(session);
  }

  @Override
  @Transactional
  public Session touchSession(UUID sessionId) {
    Session session = getSession(sessionId);
    session.touch();
    return sessionRepository.save(session);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.getWithStats", description = "Time to get session with stats")
  public SessionWithStats getSessionWithStats(UUID sessionId) {
    return withStats(getSession(sessionId));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.getAllWithStats", description = "Time to get all sessions with stats")
  public List<SessionWithStats> getAllSessionsWithStats() {
    return getAllSessions().stream().map(this::withStats).toList();
  }

  private SessionWithStats withStats(Session session) {
    return SessionWithStats.builder()
        .session(session)
        .documentCount(documentRepository.countBySessionId(session.getId()))
        .turnCount(conversationTurnRepository.countBySessionId(session.getId()))
        .build();
  }
}
