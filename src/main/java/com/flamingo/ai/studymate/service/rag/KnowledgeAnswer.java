package com.flamingo.ai.studymate.service.rag;

import java.util.List;
import java.util.Map;

/**
 * Result of a knowledge-route request. The response is always user-presentable, including for the
 * terminal failure outcomes.
 */
public record KnowledgeAnswer(
    Outcome outcome,
    String response,
    RetrievalInfo retrievalInfo,
    List<Map<String, Object>> sourcesUsed,
    int totalSources,
    int contextLength) {

  /** How the request ended. */
  public enum Outcome {
    ANSWERED,
    NO_DOCUMENTS,
    LOW_RELEVANCE,
    ERROR
  }

  static KnowledgeAnswer terminal(Outcome outcome, String response, RetrievalInfo info) {
    return new KnowledgeAnswer(outcome, response, info, List.of(), 0, 0);
  }
}
