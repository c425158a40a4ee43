package com.flamingo.ai.studymate.exception;

import java.util.UUID;

/** Exception thrown when a tutoring session does not exist. */
public class TutoringSessionNotFoundException extends ResourceNotFoundException {

  public TutoringSessionNotFoundException(UUID tutoringSessionId) {
    super("Tutoring session", tutoringSessionId);
  }

  @Override
  public String getErrorCode() {
    return ApiError.TUTORING_SESSION_NOT_FOUND;
  }
}
