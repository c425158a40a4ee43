package com.flamingo.ai.studymate.service.content;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Recognizes requests that the tutoring layer serves better than the content agent. Adaptation
 * cues are checked in order, then general tutoring cues; the first hit wins.
 */
@Component
public class DelegationDetector {

  /** Why a request is handed to the tutor. */
  public enum Adaptation {
    SIMPLIFY("simplify"),
    ADD_EXAMPLES("add_examples"),
    CHANGE_STYLE("change_style"),
    INCREASE_DIFFICULTY("increase_difficulty"),
    TUTORING("tutoring");

    private final String label;

    Adaptation(String label) {
      this.label = label;
    }

    public String getLabel() {
      return label;
    }
  }

  public record DelegationSignal(Adaptation adaptation, String keyword) {}

  private record Cue(Adaptation adaptation, List<String> keywords) {}

  private static final List<Cue> CUES =
      List.of(
          new Cue(Adaptation.SIMPLIFY, List.of("simplify", "easier", "simple")),
          new Cue(Adaptation.ADD_EXAMPLES, List.of("example", "examples", "demonstrate")),
          new Cue(
              Adaptation.CHANGE_STYLE, List.of("style", "visual", "audio", "explain differently")),
          new Cue(
              Adaptation.INCREASE_DIFFICULTY,
              List.of("harder", "difficult", "advanced", "challenge")),
          new Cue(
              Adaptation.TUTORING,
              List.of("teach me", "tutor", "quiz me", "practice", "learning style", "grade")));

  public Optional<DelegationSignal> detect(String query) {
    if (query == null || query.isBlank()) {
      return Optional.empty();
    }
    String lower = query.toLowerCase(Locale.ROOT);
    for (Cue cue : CUES) {
      for (String keyword : cue.keywords()) {
        if (lower.contains(keyword)) {
          return Optional.of(new DelegationSignal(cue.adaptation(), keyword));
        }
      }
    }
    return Optional.empty();
  }
}
