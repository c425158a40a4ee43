package com.flamingo.ai.studymate.service.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Status of a dispatched action or query. Only {@link #ERROR} signals a failure; the other
 * non-success values are soft states the client can present as-is.
 */
public enum DispatchStatus {
  SUCCESS,
  OK,
  ERROR,
  EMPTY,
  LIMIT_REACHED,
  START_OF_DOCUMENT,
  UNKNOWN_ACTION,
  NO_DOCUMENT;

  @JsonValue
  public String getLabel() {
    return name().toLowerCase(Locale.ROOT);
  }
}
