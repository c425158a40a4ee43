package com.flamingo.ai.studymate.exception;

import java.util.UUID;

/** Exception thrown when a session is not found. */
public class SessionNotFoundException extends ResourceNotFoundException {

  public SessionNotFoundException(UUID sessionId) {
    super("Session", sessionId);
  }

  @Override
  public String getErrorCode() {
    return ApiError.SESSION_NOT_FOUND;
  }
}
