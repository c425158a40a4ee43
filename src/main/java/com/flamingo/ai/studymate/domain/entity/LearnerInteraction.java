package com.flamingo.ai.studymate.domain.entity;

import com.flamingo.ai.studymate.domain.converter.JsonMapConverter;
import com.flamingo.ai.studymate.domain.enums.InteractionType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Append-only log entry of one learner interaction inside a tutoring session. */
@Entity
@Table(name = "learner_interactions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LearnerInteraction {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID tutoringSessionId;

  private String learnerId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private InteractionType interactionType;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String queryText;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String responseText;

  private Boolean wasHelpful;

  /** 1 (very easy) to 5 (very hard); null when not rated or out of range. */
  private Integer difficultyRating;

  private Double responseTimeSeconds;

  private String adaptationRequested;

  private String learningUnitId;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
