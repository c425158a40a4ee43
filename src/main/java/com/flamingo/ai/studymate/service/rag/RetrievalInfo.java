package com.flamingo.ai.studymate.service.rag;

import java.util.List;

/** What the last retrieval of a request returned, for diagnostics and API responses. */
public record RetrievalInfo(List<String> chunkIds, List<Double> similarityScores, int numChunks) {

  public static RetrievalInfo empty() {
    return new RetrievalInfo(List.of(), List.of(), 0);
  }

  public static RetrievalInfo of(List<RetrievedPassage> passages) {
    return new RetrievalInfo(
        passages.stream().map(RetrievedPassage::chunkId).toList(),
        passages.stream().map(RetrievedPassage::similarityScore).toList(),
        passages.size());
  }
}
