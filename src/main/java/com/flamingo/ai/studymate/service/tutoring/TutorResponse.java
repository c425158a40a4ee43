package com.flamingo.ai.studymate.service.tutoring;

import java.util.List;
import java.util.Map;

/**
 * Reply of the tutoring layer.
 *
 * @param sessionId tutoring session id, or the synthetic id of a guest session
 * @param inferredIndicators keywords that shaped a guest profile; empty for registered learners
 */
public record TutorResponse(
    String response,
    String learnerId,
    boolean guestSession,
    String sessionId,
    Map<String, List<String>> inferredIndicators) {}
