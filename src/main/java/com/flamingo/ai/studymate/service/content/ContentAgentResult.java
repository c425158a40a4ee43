package com.flamingo.ai.studymate.service.content;

import com.flamingo.ai.studymate.service.content.DelegationDetector.Adaptation;
import com.flamingo.ai.studymate.service.tutoring.TutorResponse;

/**
 * Outcome of the content agent.
 *
 * @param adaptation why the request was delegated; null when it was not
 * @param analysis reranked relevance analysis; null when reranking is off or nothing was retrieved
 * @param tutor reply of the tutoring layer when delegated
 */
public record ContentAgentResult(
    String response,
    String language,
    boolean documentsAvailable,
    boolean delegated,
    Adaptation adaptation,
    RelevanceAnalysis analysis,
    TutorResponse tutor) {

  static ContentAgentResult direct(String response, String language, boolean documentsAvailable) {
    return new ContentAgentResult(response, language, documentsAvailable, false, null, null, null);
  }
}
