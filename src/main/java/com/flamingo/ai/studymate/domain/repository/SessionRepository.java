package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.Session;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Session entities. */
@Repository
public interface SessionRepository extends JpaRepository<Session, UUID> {

  /** Finds all sessions ordered by last accessed time (most recent first). */
  List<Session> findAllByOrderByLastAccessedAtDesc();
}
