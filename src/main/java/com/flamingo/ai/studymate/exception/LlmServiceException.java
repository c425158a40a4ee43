package com.flamingo.ai.studymate.exception;

/**
 * Exception thrown when a call to the completion or embedding capability fails, including
 * timeouts. Carries the pipeline operation that was running so callers can pick its fallback.
 */
public class LlmServiceException extends RuntimeException {

  private static final String UNAVAILABLE =
      "AI service is temporarily unavailable. Please try again later.";

  private final String operation;
  private final String userMessage;

  public LlmServiceException(String operation, String message) {
    super(message);
    this.operation = operation;
    this.userMessage = UNAVAILABLE;
  }

  public LlmServiceException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.userMessage = UNAVAILABLE;
  }

  public String getOperation() {
    return operation;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
