package com.flamingo.ai.studymate.service.rag.embedding;

import com.flamingo.ai.studymate.exception.LlmServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns text into vectors with the configured embedding model. Failures surface as {@link
 * LlmServiceException}; nothing here retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // conservative character budget under the model's token limit for mixed Arabic/English text
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  public List<Float> embedQuery(String query) {
    String text = truncate(query);
    log.debug("embedQuery called, input length: {} chars", text.length());
    Response<Embedding> response = embeddingModel.embed(text);
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /** Embeds passages in one batch call, preserving input order. */
  @Timed(value = "embedding.embedDocuments", description = "Time to embed a batch of passages")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedDocumentsFallback")
  public List<List<Float>> embedDocuments(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = texts.stream().map(t -> TextSegment.from(truncate(t))).toList();
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<List<Float>> results = new ArrayList<>(texts.size());
    for (Embedding embedding : response.content()) {
      results.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "documents").increment();
    return results;
  }

  private String truncate(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    throw new LlmServiceException("embed_query", "Embedding failed: " + t.getMessage(), t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedDocumentsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "documents").increment();
    throw new LlmServiceException("embed_documents", "Embedding failed: " + t.getMessage(), t);
  }
}
