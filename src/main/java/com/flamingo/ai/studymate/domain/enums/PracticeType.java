package com.flamingo.ai.studymate.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Kinds of practice material. */
public enum PracticeType {
  PROBLEMS,
  QUIZ,
  EXERCISES,
  ASSESSMENT,
  FLASHCARDS;

  public String getLabel() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<PracticeType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toUpperCase(Locale.ROOT);
    for (PracticeType type : values()) {
      if (type.name().equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
