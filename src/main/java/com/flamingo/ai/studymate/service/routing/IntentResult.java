package com.flamingo.ai.studymate.service.routing;

import com.flamingo.ai.studymate.domain.enums.IntentType;

/**
 * Outcome of intent classification.
 *
 * @param intentType action or query
 * @param confidence confidence reported by the model, or 0.0 when it was overridden
 * @param details explanation from the model, or the reason for the override
 * @param fallback whether the result was forced to the default route
 */
public record IntentResult(
    IntentType intentType, double confidence, String details, boolean fallback) {}
