package com.flamingo.ai.studymate.service.assistant;

import java.util.UUID;

/** Entry point for a single user utterance: classify, route, dispatch. */
public interface AssistantService {

  /**
   * Handles one utterance.
   *
   * @param sessionId session whose workspace the utterance acts on; null for session-less callers
   * @param utterance raw user text, possibly blank
   * @param documentId document the caller has in view, if any
   * @param learnerId durable learner id for tutoring; null means guest
   * @throws com.flamingo.ai.studymate.exception.SessionNotFoundException if the session is unknown
   */
  AssistantReply handle(UUID sessionId, String utterance, UUID documentId, String learnerId);
}
