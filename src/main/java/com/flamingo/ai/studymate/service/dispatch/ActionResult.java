package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.domain.enums.ActionType;
import java.util.Map;

/** Result of an action handler. {@code data} carries handler-specific fields. */
public record ActionResult(
    DispatchStatus status, ActionType actionType, String message, Map<String, Object> data) {

  static ActionResult of(DispatchStatus status, ActionType type, String message) {
    return new ActionResult(status, type, message, Map.of());
  }
}
