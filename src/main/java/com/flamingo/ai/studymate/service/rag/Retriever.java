package com.flamingo.ai.studymate.service.rag;

import com.flamingo.ai.studymate.elasticsearch.DocumentChunk;
import com.flamingo.ai.studymate.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.studymate.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.studymate.service.rag.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds a query and returns the nearest chunks as {@link RetrievedPassage}s, closest first.
 *
 * <p>Elasticsearch reports cosine hits as {@code (1 + cos) / 2}; this is converted back to the
 * cosine distance {@code 1 - cos = 2 * (1 - esScore)}, from which the similarity score follows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private static final Comparator<RetrievedPassage> BY_DISTANCE =
      Comparator.comparingDouble(RetrievedPassage::similarityDistance);

  private final EmbeddingService embeddingService;
  private final DocumentChunkIndexService chunkIndexService;

  /**
   * Retrieves up to {@code topK} passages.
   *
   * @param sessionId session scope, used when no document is given; may be null
   * @param documentId document scope; may be null
   * @return passages by ascending distance, ties in search order; empty for an empty corpus
   * @throws EmbeddingDimensionMismatchException if the query vector does not fit the index
   */
  @Timed(value = "rag.retrieve", description = "Time to retrieve passages")
  public List<RetrievedPassage> retrieve(UUID sessionId, UUID documentId, String query, int topK) {
    List<Float> embedding = embeddingService.embedQuery(query);
    int expected = chunkIndexService.getVectorDimensions();
    if (embedding.size() != expected) {
      throw new EmbeddingDimensionMismatchException(expected, embedding.size());
    }

    List<DocumentChunk> chunks = chunkIndexService.search(sessionId, documentId, embedding, topK);
    List<RetrievedPassage> passages = new ArrayList<>(chunks.size());
    for (DocumentChunk chunk : chunks) {
      passages.add(toPassage(chunk));
    }
    // List.sort is stable, so equal distances keep search order
    passages.sort(BY_DISTANCE);

    log.debug(
        "Retrieved {} passages (session={}, document={}, topK={})",
        passages.size(),
        sessionId,
        documentId,
        topK);
    return passages.size() > topK ? List.copyOf(passages.subList(0, topK)) : passages;
  }

  private RetrievedPassage toPassage(DocumentChunk chunk) {
    double searchScore = chunk.getSearchScore() != null ? chunk.getSearchScore() : 0.0;
    double distance = 2.0 * (1.0 - searchScore);
    return RetrievedPassage.of(
        chunk.getId(),
        chunk.getDocumentId(),
        chunk.getDocumentTitle(),
        chunk.getPageNumber(),
        chunk.getLanguage(),
        chunk.getContent(),
        distance);
  }
}
