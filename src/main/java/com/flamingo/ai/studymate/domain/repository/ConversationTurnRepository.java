package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.ConversationTurn;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ConversationTurn entities. */
@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, UUID> {

  /** Finds all turns of a session ordered by creation time ascending. */
  List<ConversationTurn> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

  /** Latest turn of a session. */
  Optional<ConversationTurn> findFirstBySessionIdOrderByCreatedAtDesc(UUID sessionId);

  /** Finds the most recent turns of a session, newest first (for the history window). */
  @Query(
      "SELECT t FROM ConversationTurn t WHERE t.sessionId = :sessionId "
          + "ORDER BY t.createdAt DESC")
  List<ConversationTurn> findRecentTurns(@Param("sessionId") UUID sessionId, Pageable pageable);

  /** Counts turns by session. */
  long countBySessionId(UUID sessionId);
}
