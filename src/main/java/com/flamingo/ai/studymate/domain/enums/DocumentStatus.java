package com.flamingo.ai.studymate.domain.enums;

/** Ingestion status of a document. */
public enum DocumentStatus {
  /** Stored, chunks not yet embedded and indexed. */
  PENDING,

  /** Chunks embedded and searchable. */
  INDEXED,

  /** Chunking, embedding or indexing failed; page text is still available for navigation. */
  FAILED
}
