package com.flamingo.ai.studymate.domain.entity;

import com.flamingo.ai.studymate.domain.converter.JsonMapConverter;
import com.flamingo.ai.studymate.domain.converter.JsonMapListConverter;
import com.flamingo.ai.studymate.domain.converter.StringListConverter;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Durable model of a learner. Guest profiles share this shape but are built in memory with
 * {@code guestSession = true} and never saved.
 *
 * <p>Performance metrics are only changed through running averages; see {@code
 * LearnerModelManager}.
 */
@Entity
@Table(name = "learner_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LearnerProfile {

  public static final String GUEST_ID_PREFIX = "guest_";

  @Id private String id;

  private String name;

  @Column(nullable = false)
  @Builder.Default
  private Integer gradeLevel = 8;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private LearningStyle learningStyle = LearningStyle.MIXED;

  @Builder.Default private String preferredLanguage = "English";

  /** easy, medium or challenging. */
  @Builder.Default private String difficultyPreference = "medium";

  @Builder.Default private Double accuracyRate = 0.7;

  @Builder.Default private Double avgResponseTime = 15.0;

  @Builder.Default private Double completionRate = 0.8;

  @Builder.Default private Integer totalSessions = 0;

  /** Entries of {@code {topic, type, timestamp}}. */
  @Convert(converter = JsonMapListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<Map<String, Object>> learningStruggles = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> masteredTopics = new ArrayList<>();

  /** Entries of {@code {style, effectiveness}}, most preferred first. */
  @Convert(converter = JsonMapListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<Map<String, Object>> preferredExplanationStyles = new ArrayList<>();

  /** Free-form learner preferences, including accessibility needs such as screen_reader. */
  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> preferences = new LinkedHashMap<>();

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> interactionPatterns = new LinkedHashMap<>();

  @Transient @Builder.Default private boolean guestSession = false;

  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean hasStruggles() {
    return learningStruggles != null && !learningStruggles.isEmpty();
  }

  /** Topics the learner struggles with, in recording order. */
  public List<String> struggleTopics() {
    if (learningStruggles == null) {
      return List.of();
    }
    return learningStruggles.stream()
        .map(entry -> entry.get("topic"))
        .filter(Objects::nonNull)
        .map(Object::toString)
        .toList();
  }

  /** Whether an identifier belongs to a synthetic guest learner. */
  public static boolean isGuestId(String learnerId) {
    return learnerId != null && learnerId.startsWith(GUEST_ID_PREFIX);
  }
}
