package com.flamingo.ai.studymate.domain.entity;

import com.flamingo.ai.studymate.domain.converter.JsonMapConverter;
import com.flamingo.ai.studymate.domain.converter.JsonMapListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A tutoring session of a registered learner. Lifecycle: active on creation, ended exactly once.
 * The performance summary is written only when the session ends.
 */
@Entity
@Table(name = "tutoring_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TutoringSession {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  private String learnerId;

  private String currentTopic;

  /** Rolling state, including the {@code learning_progress} counters. */
  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> sessionState = new LinkedHashMap<>();

  @Convert(converter = JsonMapListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<Map<String, Object>> interactionHistory = new ArrayList<>();

  @Column(nullable = false)
  @Builder.Default
  private Boolean active = true;

  @Column(nullable = false, updatable = false)
  private LocalDateTime startedAt;

  private LocalDateTime endedAt;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Object> performanceSummary;

  @PrePersist
  protected void onCreate() {
    if (startedAt == null) {
      startedAt = LocalDateTime.now();
    }
  }

  /** Ends the session, recording the summary. Has no effect on an already ended session. */
  public void end(Map<String, Object> summary) {
    if (!Boolean.TRUE.equals(active)) {
      return;
    }
    this.active = false;
    this.endedAt = LocalDateTime.now();
    this.performanceSummary = summary;
  }

  /** Elapsed time between start and end, or null when either timestamp is missing. */
  public Duration duration() {
    if (startedAt == null || endedAt == null) {
      return null;
    }
    return Duration.between(startedAt, endedAt);
  }
}
