package com.flamingo.ai.studymate.exception;

/** Query embedding length differs from the dimension the chunk index was built with. */
public class EmbeddingDimensionMismatchException extends RuntimeException {

  private final int expectedDimensions;
  private final int actualDimensions;

  public EmbeddingDimensionMismatchException(int expectedDimensions, int actualDimensions) {
    super(
        "Embedding dimension mismatch: index expects "
            + expectedDimensions
            + " but query vector has "
            + actualDimensions);
    this.expectedDimensions = expectedDimensions;
    this.actualDimensions = actualDimensions;
  }

  public int getExpectedDimensions() {
    return expectedDimensions;
  }

  public int getActualDimensions() {
    return actualDimensions;
  }
}
