package com.flamingo.ai.studymate.elasticsearch;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored, embedded slice of a document: the unit of retrieval. Chunks are written once and
 * never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private UUID documentId;

  /** Null for documents without a session. */
  private UUID sessionId;

  private String documentTitle;
  private int chunkIndex;

  /** Originating page, when the document was paginated. */
  private Integer pageNumber;

  private String language;
  private String content;
  private List<Float> embedding;

  /**
   * Raw Elasticsearch score of the hit. For a cosine {@code dense_vector} field this is {@code (1
   * + cosine) / 2}.
   */
  private Double searchScore;
}
