package com.flamingo.ai.studymate.exception;

import java.util.UUID;

/** Exception thrown when a document is not found. */
public class DocumentNotFoundException extends ResourceNotFoundException {

  public DocumentNotFoundException(UUID documentId) {
    super("Document", documentId);
  }

  @Override
  public String getErrorCode() {
    return ApiError.DOCUMENT_NOT_FOUND;
  }
}
