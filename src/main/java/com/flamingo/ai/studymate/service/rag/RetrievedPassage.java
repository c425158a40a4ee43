package com.flamingo.ai.studymate.service.rag;

import java.util.UUID;

/**
 * A chunk returned by nearest-neighbor search, with its cosine distance and the derived score.
 * {@code similarityScore == 1 - similarityDistance} always holds.
 */
public record RetrievedPassage(
    String chunkId,
    UUID documentId,
    String documentTitle,
    Integer pageNumber,
    String language,
    String content,
    double similarityDistance,
    double similarityScore) {

  public static RetrievedPassage of(
      String chunkId,
      UUID documentId,
      String documentTitle,
      Integer pageNumber,
      String language,
      String content,
      double similarityDistance) {
    return new RetrievedPassage(
        chunkId,
        documentId,
        documentTitle,
        pageNumber,
        language,
        content,
        similarityDistance,
        1.0 - similarityDistance);
  }

  /** Human-readable provenance: the document title, with the page when known. */
  public String sourceLabel() {
    String title = documentTitle != null ? documentTitle : "Unknown";
    return pageNumber != null ? title + ", page " + pageNumber : title;
  }
}
