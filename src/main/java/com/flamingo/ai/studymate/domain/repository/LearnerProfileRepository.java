package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for LearnerProfile entities. */
@Repository
public interface LearnerProfileRepository extends JpaRepository<LearnerProfile, String> {}
