package com.flamingo.ai.studymate.service.content;

import java.util.UUID;

/**
 * Input of the content agent. Everything but the query is optional; a missing learner id makes a
 * delegated request a guest interaction.
 */
public record ContentAgentRequest(
    UUID sessionId, UUID documentId, String query, String learnerId, String previousQuery) {

  public static ContentAgentRequest of(String query) {
    return new ContentAgentRequest(null, null, query, null, null);
  }
}
