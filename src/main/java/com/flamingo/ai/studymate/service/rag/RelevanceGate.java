package com.flamingo.ai.studymate.service.rag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/** Decides whether retrieved passages are good enough to ground an answer. */
@Component
public class RelevanceGate {

  /**
   * Checks passages against a threshold.
   *
   * @param passages retrieved passages, any order
   * @param threshold minimum best score to accept the set
   * @param topN passages to keep for downstream stages
   * @return relevant iff the best score reaches the threshold; an empty input is never relevant
   */
  public GateResult check(List<RetrievedPassage> passages, double threshold, int topN) {
    if (passages == null || passages.isEmpty()) {
      return new GateResult(false, 0.0, List.of());
    }
    List<RetrievedPassage> ordered = new ArrayList<>(passages);
    ordered.sort(Comparator.comparingDouble(RetrievedPassage::similarityScore).reversed());

    double maxScore = ordered.get(0).similarityScore();
    List<RetrievedPassage> selected =
        List.copyOf(ordered.subList(0, Math.min(topN, ordered.size())));
    return new GateResult(maxScore >= threshold, maxScore, selected);
  }

  /** Gate outcome with the passages selected for context assembly. */
  public record GateResult(boolean relevant, double maxScore, List<RetrievedPassage> selected) {}
}
