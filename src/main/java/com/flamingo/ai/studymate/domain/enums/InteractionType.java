package com.flamingo.ai.studymate.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Kind of learner interaction recorded in a tutoring session. */
public enum InteractionType {
  QUESTION,
  EXPLANATION,
  PRACTICE,
  ASSESSMENT,
  HINT,
  FEEDBACK;

  public String getLabel() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<InteractionType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toUpperCase(Locale.ROOT);
    for (InteractionType type : values()) {
      if (type.name().equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
