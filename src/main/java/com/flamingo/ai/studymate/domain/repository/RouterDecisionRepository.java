package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.RouterDecision;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for RouterDecision audit records. */
@Repository
public interface RouterDecisionRepository extends JpaRepository<RouterDecision, UUID> {

  List<RouterDecision> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);
}
