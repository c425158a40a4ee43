package com.flamingo.ai.studymate.exception;

/** Exception thrown when a registered learner profile does not exist. */
public class LearnerNotFoundException extends ResourceNotFoundException {

  public LearnerNotFoundException(String learnerId) {
    super("Learner profile", learnerId);
  }

  @Override
  public String getErrorCode() {
    return ApiError.LEARNER_NOT_FOUND;
  }
}
