package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.TutoringSession;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for TutoringSession entities. */
@Repository
public interface TutoringSessionRepository extends JpaRepository<TutoringSession, UUID> {

  /** The learner's active session, if any. */
  Optional<TutoringSession> findFirstByLearnerIdAndActiveTrueOrderByStartedAtDesc(
      String learnerId);

  /** All sessions still flagged active for a learner; more than one indicates a repair case. */
  List<TutoringSession> findByLearnerIdAndActiveTrue(String learnerId);

  long countByLearnerId(String learnerId);
}
