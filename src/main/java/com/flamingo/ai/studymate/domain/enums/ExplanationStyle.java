package com.flamingo.ai.studymate.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Presentation styles the explanation engine can produce. */
public enum ExplanationStyle {
  SIMPLIFIED("simplified", "Simplified", List.of("simple", "easy", "basic")),
  DETAILED("detailed", "Detailed", List.of("detail", "thorough", "comprehensive")),
  ANALOGY("analogy", "Analogy", List.of("analogy", "metaphor", "like")),
  STEP_BY_STEP("step-by-step", "Step By Step", List.of("step", "steps", "sequential")),
  VISUAL("visual", "Visual", List.of("visual", "picture", "diagram")),
  INTERACTIVE("interactive", "Interactive", List.of("interactive", "engaging")),
  PRACTICAL("practical", "Practical", List.of("practical", "real-world", "hands-on"));

  private final String label;
  private final String title;
  private final List<String> keywords;

  ExplanationStyle(String label, String title, List<String> keywords) {
    this.label = label;
    this.title = title;
    this.keywords = keywords;
  }

  public String getLabel() {
    return label;
  }

  public String getTitle() {
    return title;
  }

  public List<String> getKeywords() {
    return keywords;
  }

  public static Optional<ExplanationStyle> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (ExplanationStyle style : values()) {
      if (style.label.equals(normalized)) {
        return Optional.of(style);
      }
    }
    return Optional.empty();
  }
}
