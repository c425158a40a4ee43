package com.flamingo.ai.studymate.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link DocumentChunk} documents.
 *
 * <p>Searches are scoped to one document when a document id is given, otherwise to one session,
 * otherwise to the whole index.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk> {

  public static final String DOCUMENT_ID = "documentId";
  public static final String SESSION_ID = "sessionId";

  @Value("${app.elasticsearch.index-name:studymate-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:768}")
  private int vectorDimensions;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ids must be keyword for exact term filtering
    properties.put(DOCUMENT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(SESSION_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put("documentTitle", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("language", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(DOCUMENT_ID, chunk.getDocumentId().toString());
    if (chunk.getSessionId() != null) {
      document.put(SESSION_ID, chunk.getSessionId().toString());
    }
    document.put("documentTitle", chunk.getDocumentTitle());
    document.put("chunkIndex", chunk.getChunkIndex());
    if (chunk.getPageNumber() != null) {
      document.put("pageNumber", chunk.getPageNumber());
    }
    if (chunk.getLanguage() != null) {
      document.put("language", chunk.getLanguage());
    }
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    Object sessionId = source.get(SESSION_ID);
    Object chunkIndex = source.get("chunkIndex");
    Object pageNumber = source.get("pageNumber");
    return DocumentChunk.builder()
        .id((String) source.get("id"))
        .documentId(UUID.fromString((String) source.get(DOCUMENT_ID)))
        .sessionId(sessionId != null ? UUID.fromString((String) sessionId) : null)
        .documentTitle((String) source.get("documentTitle"))
        .chunkIndex(chunkIndex instanceof Number n ? n.intValue() : 0)
        .pageNumber(pageNumber instanceof Number n ? n.intValue() : null)
        .language((String) source.get("language"))
        .content((String) source.get("content"))
        .build();
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    Query filter = buildScopeFilter(filterCriteria);
    log.debug(
        "vectorSearch index={} topK={} dims={} filter={}",
        indexName,
        topK,
        queryEmbedding.size(),
        filterCriteria);

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field("embedding")
                          .queryVector(queryEmbedding)
                          .k(topK)
                          .numCandidates(Math.max(topK * 2, 20));
                      if (filter != null) {
                        k.filter(filter);
                      }
                      return k;
                    })
                .size(topK));
  }

  /** Document scope wins over session scope; no criteria means the whole index. */
  private Query buildScopeFilter(Map<String, Object> criteria) {
    Object documentId = criteria.get(DOCUMENT_ID);
    if (documentId != null) {
      return Query.of(q -> q.term(t -> t.field(DOCUMENT_ID).value(documentId.toString())));
    }
    Object sessionId = criteria.get(SESSION_ID);
    if (sessionId != null) {
      return Query.of(q -> q.term(t -> t.field(SESSION_ID).value(sessionId.toString())));
    }
    return null;
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Query query = buildScopeFilter(criteria);
    if (query == null) {
      throw new IllegalArgumentException(
          "deleteBy requires either documentId or sessionId in criteria");
    }
    return query;
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }

  /** Searches chunks of one document when {@code documentId} is set, else of one session. */
  public List<DocumentChunk> search(
      UUID sessionId, UUID documentId, List<Float> queryEmbedding, int topK) {
    Map<String, Object> criteria = new HashMap<>();
    if (documentId != null) {
      criteria.put(DOCUMENT_ID, documentId);
    } else if (sessionId != null) {
      criteria.put(SESSION_ID, sessionId);
    }
    return vectorSearch(criteria, queryEmbedding, topK);
  }

  public void deleteByDocumentId(UUID documentId) {
    deleteBy(Map.of(DOCUMENT_ID, documentId));
  }
}
