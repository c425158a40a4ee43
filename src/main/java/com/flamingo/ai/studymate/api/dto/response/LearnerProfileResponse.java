package com.flamingo.ai.studymate.api.dto.response;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a learner profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearnerProfileResponse {

  private String id;
  private String name;
  private Integer gradeLevel;
  private LearningStyle learningStyle;
  private String preferredLanguage;
  private String difficultyPreference;
  private Double accuracyRate;
  private Double avgResponseTime;
  private Double completionRate;
  private Integer totalSessions;
  private List<Map<String, Object>> learningStruggles;
  private List<String> masteredTopics;
  private Map<String, Object> preferences;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  public static LearnerProfileResponse fromEntity(LearnerProfile profile) {
    return LearnerProfileResponse.builder()
        .id(profile.getId())
        .name(profile.getName())
        .gradeLevel(profile.getGradeLevel())
        .learningStyle(profile.getLearningStyle())
        .preferredLanguage(profile.getPreferredLanguage())
        .difficultyPreference(profile.getDifficultyPreference())
        .accuracyRate(profile.getAccuracyRate())
        .avgResponseTime(profile.getAvgResponseTime())
        .completionRate(profile.getCompletionRate())
        .totalSessions(profile.getTotalSessions())
        .learningStruggles(profile.getLearningStruggles())
        .masteredTopics(profile.getMasteredTopics())
        .preferences(profile.getPreferences())
        .createdAt(profile.getCreatedAt())
        .updatedAt(profile.getUpdatedAt())
        .build();
  }
}
