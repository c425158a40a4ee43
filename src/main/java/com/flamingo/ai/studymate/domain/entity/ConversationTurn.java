package com.flamingo.ai.studymate.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Append-only record of one utterance and the answer produced for it. */
@Entity
@Table(name = "conversation_turns")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurn {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** Null for session-less callers. */
  private UUID sessionId;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String userQuery;

  @Column(columnDefinition = "TEXT")
  private String answer;

  /** Action type or query route label that produced the answer. */
  private String handledBy;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
