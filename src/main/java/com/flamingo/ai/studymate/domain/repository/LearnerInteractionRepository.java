package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.LearnerInteraction;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for LearnerInteraction entities. */
@Repository
public interface LearnerInteractionRepository extends JpaRepository<LearnerInteraction, UUID> {

  List<LearnerInteraction> findByTutoringSessionIdOrderByCreatedAtAsc(UUID tutoringSessionId);

  long countByTutoringSessionId(UUID tutoringSessionId);
}
