package com.flamingo.ai.studymate.service.routing;

import com.flamingo.ai.studymate.domain.enums.ActionType;

/**
 * Outcome of action sub-routing.
 *
 * @param actionType concrete action, {@link ActionType#UNKNOWN} when unresolved
 * @param confidence model confidence
 * @param details model explanation or clarification message
 * @param arguments arguments extracted by the router
 */
public record ActionRoute(
    ActionType actionType, double confidence, String details, ActionArguments arguments) {}
