package com.flamingo.ai.studymate.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /** Creates the index if it doesn't exist, or validates and extends its mapping. */
  void initIndex();

  /**
   * Indexes multiple documents in bulk.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Nearest-neighbor search by cosine similarity.
   *
   * @param filterCriteria exact-match filters (e.g. sessionId, documentId); may be empty
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents ordered by descending similarity, each carrying its raw score
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   */
  void deleteBy(Map<String, Object> criteria);

  /** Refreshes the index to make recent changes visible for search. */
  void refresh();

  String getIndexName();

  /** Vector dimension the index mapping was created with. */
  int getVectorDimensions();
}
