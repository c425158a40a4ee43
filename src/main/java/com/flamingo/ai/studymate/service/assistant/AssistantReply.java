package com.flamingo.ai.studymate.service.assistant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.studymate.domain.enums.IntentType;
import com.flamingo.ai.studymate.service.dispatch.ActionResult;
import com.flamingo.ai.studymate.service.dispatch.QueryResult;

/**
 * Full trace of one assistant turn: how the utterance was classified, where it was routed and what
 * the handler returned. Exactly one of {@code action} and {@code query} is set.
 *
 * @param routedTo label of the action or query route that handled the turn
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssistantReply(
    IntentType intent,
    double intentConfidence,
    String intentDetails,
    String routedTo,
    double routeConfidence,
    String routeDetails,
    ActionResult action,
    QueryResult query) {

  /** Text to show the user for this turn. */
  public String message() {
    if (action != null) {
      return action.message();
    }
    return query != null ? query.response() : null;
  }
}
