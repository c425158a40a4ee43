package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.domain.enums.ActionType;
import com.flamingo.ai.studymate.service.routing.ActionArguments;
import java.util.UUID;

/**
 * A routed action.
 *
 * @param sessionId owning session; null for session-less callers
 * @param arguments arguments extracted by the router, never null
 * @param utterance original text, used when the arguments are incomplete
 * @param details router explanation, surfaced for {@link ActionType#UNKNOWN}
 */
public record ActionRequest(
    UUID sessionId,
    ActionType type,
    ActionArguments arguments,
    String utterance,
    String details) {

  public ActionRequest {
    if (arguments == null) {
      arguments = ActionArguments.none();
    }
  }
}
