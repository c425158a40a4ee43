package com.flamingo.ai.studymate.service.rag.rerank;

import com.flamingo.ai.studymate.service.rag.RetrievedPassage;
import java.util.List;

/** Reorders retrieved passages by a query-passage relevance score. */
public interface Reranker {

  /**
   * Scores passages against the query.
   *
   * @return passages by descending score, each annotated with its score and 1-based rank
   */
  List<RankedPassage> rerank(String query, List<RetrievedPassage> passages);

  /** A passage with the reranker's score and its rank in the reranked order. */
  record RankedPassage(RetrievedPassage passage, double score, int rank) {}
}
