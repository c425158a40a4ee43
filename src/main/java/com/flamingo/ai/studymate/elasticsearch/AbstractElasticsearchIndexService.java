package com.flamingo.ai.studymate.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.studymate.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch vector index services.
 *
 * <p>Provides index bootstrap, bulk indexing, filtered kNN search and delete-by-query.
 * Subclasses define the schema and the conversion between entities and index documents.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /** Defines the index properties (schema) for this document type. */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /** Metric prefix for this index (e.g. "chunk"). */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and fails on type mismatches, which need the index
   * to be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      log.error("Index '{}' has incompatible mappings: {}", getIndexName(), mismatches);
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). Delete the index and restart: "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  @CircuitBreaker(name = "elasticsearch")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new SearchException(
            getIndexName(), "Bulk indexing reported item failures: " + response.items(), null);
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException(getIndexName(), "Failed to index documents", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults(filterCriteria, response);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException(getIndexName(), "Vector search failed", e);
    }
  }

  /** Counts the failure and rethrows it as a typed search failure; results are never faked. */
  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    if (t instanceof SearchException searchException) {
      throw searchException;
    }
    throw new SearchException(getIndexName(), "Vector search unavailable: " + t.getMessage(), t);
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery));
      elasticsearchClient.deleteByQuery(request);
      log.info("Deleted documents from {} with criteria: {}", getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new SearchException(getIndexName(), "Failed to delete documents", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  private void logSearchResults(Map<String, Object> filterCriteria, SearchResponse<Map> response) {
    List<Hit<Map>> hits = response.hits().hits();
    log.debug(
        "[vectorSearch] index={} filter={} returned={}",
        getIndexName(),
        filterCriteria,
        hits.size());
    for (int i = 0; i < hits.size(); i++) {
      Hit<Map> hit = hits.get(i);
      log.debug("  [vectorSearch] rank={} id={} score={}", i + 1, hit.id(), hit.score());
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setSearchScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Documents that carry the raw search score of the hit they were read from. */
  public interface ScoredDocument {
    void setSearchScore(Double score);
  }
}
