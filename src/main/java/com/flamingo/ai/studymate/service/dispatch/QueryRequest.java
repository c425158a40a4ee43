package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import java.util.UUID;

/**
 * A routed knowledge query.
 *
 * @param documentId document the caller has in view, if any
 * @param learnerId durable learner id for the tutoring routes; null means guest
 */
public record QueryRequest(
    UUID sessionId, QueryRoute route, String query, UUID documentId, String learnerId) {}
