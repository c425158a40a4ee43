package com.flamingo.ai.studymate.domain.enums;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Handler a query is routed to. */
public enum QueryRoute {
  /** Grounded question answering and self-testing over the uploaded documents. */
  QA("qa"),

  /** Grounded summary of the uploaded documents. */
  SUMMARIZATION("summarization"),

  /** General content agent (explanations, free-form chat). */
  CONTENT_AGENT("content_agent"),

  /** Adaptive tutoring agent. */
  TUTOR_AGENT("tutor_agent"),

  /** Router could not decide; handled as general chat. */
  UNKNOWN("unknown");

  private static final Set<String> CONTENT_AGENT_ALIASES =
      Set.of("agents", "agent", "content_processor_agent");

  private final String label;

  QueryRoute(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public boolean isKnowledgeRoute() {
    return this == QA || this == SUMMARIZATION;
  }

  /** Resolves a router label, accepting the "agents" alias used by the routing prompt. */
  public static Optional<QueryRoute> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    if (CONTENT_AGENT_ALIASES.contains(normalized)) {
      return Optional.of(CONTENT_AGENT);
    }
    for (QueryRoute route : values()) {
      if (route.label.equals(normalized)) {
        return Optional.of(route);
      }
    }
    return Optional.empty();
  }
}
