package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.api.dto.request.CreateLearnerRequest;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import java.util.Optional;

/** Service interface for durable learner profiles. Guest profiles never pass through here. */
public interface LearnerProfileService {

  LearnerProfile createProfile(CreateLearnerRequest request);

  /**
   * Gets a profile by learner id.
   *
   * @throws com.flamingo.ai.studymate.exception.LearnerNotFoundException if not found
   */
  LearnerProfile getProfile(String learnerId);

  Optional<LearnerProfile> findProfile(String learnerId);

  LearnerProfile save(LearnerProfile profile);
}
