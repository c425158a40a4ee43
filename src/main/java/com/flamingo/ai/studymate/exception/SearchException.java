package com.flamingo.ai.studymate.exception;

/** Exception thrown when the vector store cannot serve a search. */
public class SearchException extends RuntimeException {

  private final String indexName;
  private final String userMessage;

  public SearchException(String indexName, String message, Throwable cause) {
    super(message, cause);
    this.indexName = indexName;
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getIndexName() {
    return indexName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
