package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.domain.entity.ConversationTurn;
import com.flamingo.ai.studymate.domain.repository.ConversationTurnRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Appends conversation turns. Writes are best-effort and never fail the calling request. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationTurnRecorder {

  private final ConversationTurnRepository conversationTurnRepository;
  private final MeterRegistry meterRegistry;

  /** Saves outside any caller transaction so a failure cannot roll back the caller's work. */
  public void record(UUID sessionId, String userQuery, String answer, String handledBy) {
    try {
      conversationTurnRepository.save(
          ConversationTurn.builder()
              .sessionId(sessionId)
              .userQuery(userQuery != null ? userQuery : "")
              .answer(answer)
              .handledBy(handledBy)
              .build());
    } catch (Exception e) {
      log.warn("Failed to record conversation turn for session {}: {}", sessionId, e.getMessage());
      meterRegistry.counter("persistence.best_effort.failures", "record", "conversation_turn")
          .increment();
    }
  }

  /** The user text of the session's latest turn. */
  @Transactional(readOnly = true)
  public Optional<String> previousQuery(UUID sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return conversationTurnRepository
        .findFirstBySessionIdOrderByCreatedAtDesc(sessionId)
        .map(ConversationTurn::getUserQuery);
  }
}
