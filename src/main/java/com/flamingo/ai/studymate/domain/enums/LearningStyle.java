package com.flamingo.ai.studymate.domain.enums;

import java.util.List;
import java.util.Locale;

/** Learning style tag of a learner profile, with the content formats that suit it. */
public enum LearningStyle {
  VISUAL("Visual", List.of("diagrams", "charts", "step-by-step_visuals", "infographics")),
  AUDITORY("Auditory", List.of("verbal_explanations", "discussions", "audio_content")),
  KINESTHETIC("Kinesthetic", List.of("hands_on", "interactive", "practice_exercises")),
  ANALYTICAL(
      "Analytical", List.of("detailed_explanations", "logical_proofs", "systematic_approach")),
  CREATIVE(
      "Creative", List.of("open_ended", "artistic_connections", "real_world_applications")),
  MIXED("Mixed", List.of("varied_approaches", "multi_modal", "adaptive_content"));

  private final String displayName;
  private final List<String> preferredFormats;

  LearningStyle(String displayName, List<String> preferredFormats) {
    this.displayName = displayName;
    this.preferredFormats = preferredFormats;
  }

  public String getDisplayName() {
    return displayName;
  }

  public List<String> getPreferredFormats() {
    return preferredFormats;
  }

  /** Parses a display name or enum name; anything unrecognized is {@link #MIXED}. */
  public static LearningStyle fromName(String name) {
    if (name == null) {
      return MIXED;
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (LearningStyle style : values()) {
      if (style.name().equals(normalized)) {
        return style;
      }
    }
    return MIXED;
  }
}
