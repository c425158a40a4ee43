package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.api.dto.request.CreateLearnerRequest;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.repository.LearnerProfileRepository;
import com.flamingo.ai.studymate.exception.LearnerNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class LearnerProfileServiceImpl implements LearnerProfileService {

  private final LearnerProfileRepository learnerProfileRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "learner.create", description = "Time to register a learner")
  public LearnerProfile createProfile(CreateLearnerRequest request) {
    String id =
        request.getId() != null && !request.getId().isBlank()
            ? request.getId().trim()
            : UUID.randomUUID().toString();

    LearnerProfile.LearnerProfileBuilder builder =
        LearnerProfile.builder().id(id).name(request.getName());
    if (request.getGradeLevel() != null) {
      builder.gradeLevel(request.getGradeLevel());
    }
    if (request.getLearningStyle() != null) {
      builder.learningStyle(request.getLearningStyle());
    }
    if (request.getPreferredLanguage() != null) {
      builder.preferredLanguage(request.getPreferredLanguage());
    }
    if (request.getDifficultyPreference() != null) {
      builder.difficultyPreference(request.getDifficultyPreference());
    }
    if (request.getPreferences() != null) {
      builder.preferences(new LinkedHashMap<>(request.getPreferences()));
    }

    LearnerProfile saved = learnerProfileRepository.save(builder.build());
    meterRegistry.counter("learner.created").increment();
    log.info(
        "Registered learner {} (grade {}, {})",
        saved.getId(),
        saved.getGradeLevel(),
        saved.getLearningStyle().getDisplayName());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public LearnerProfile getProfile(String learnerId) {
    return findProfile(learnerId).orElseThrow(() -> new LearnerNotFoundException(learnerId));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<LearnerProfile> findProfile(String learnerId) {
    if (learnerId == null || LearnerProfile.isGuestId(learnerId)) {
      return Optional.empty();
    }
    return learnerProfileRepository.findById(learnerId);
  }

  @Override
  @Transactional
  public LearnerProfile save(LearnerProfile profile) {
    if (profile.isGuestSession()) {
      throw new IllegalArgumentException("Guest profiles are never persisted");
    }
    return learnerProfileRepository.save(profile);
  }
}
