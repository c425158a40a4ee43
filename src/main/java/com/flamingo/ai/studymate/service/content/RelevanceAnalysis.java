package com.flamingo.ai.studymate.service.content;

import java.util.List;

/**
 * Reranked view of the passages retrieved for a content request.
 *
 * @param citedIds passages whose reranked score reaches the delegation threshold
 */
public record RelevanceAnalysis(
    String query, List<RankedEntry> rankedPassages, List<String> citedIds) {

  public record RankedEntry(String id, double score, int rank) {}
}
