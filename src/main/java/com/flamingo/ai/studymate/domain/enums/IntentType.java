package com.flamingo.ai.studymate.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Top-level intent of an utterance. */
public enum IntentType {
  /** Navigation or workspace command ("open physics", "add a note"). */
  ACTION("action"),

  /** Knowledge request answered from documents or by an agent. */
  QUERY("query");

  private final String label;

  IntentType(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /** Resolves a label produced by the classifier, ignoring case and surrounding whitespace. */
  public static Optional<IntentType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    for (IntentType type : values()) {
      if (type.label.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
