package com.flamingo.ai.studymate.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Difficulty level of generated practice material. */
public enum PracticeDifficulty {
  EASY,
  MEDIUM,
  HARD;

  public String getLabel() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** One level harder, saturating at {@link #HARD}. */
  public PracticeDifficulty harder() {
    return this == EASY ? MEDIUM : HARD;
  }

  /** One level easier, saturating at {@link #EASY}. */
  public PracticeDifficulty easier() {
    return this == HARD ? MEDIUM : EASY;
  }

  /**
   * Maps difficulty labels used across the learner model ("challenging" is a profile preference,
   * "hard" a practice level).
   */
  public static Optional<PracticeDifficulty> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "easy", "beginner", "simple" -> Optional.of(EASY);
      case "medium", "intermediate", "moderate" -> Optional.of(MEDIUM);
      case "hard", "challenging", "advanced", "difficult" -> Optional.of(HARD);
      default -> Optional.empty();
    };
  }
}
