package com.flamingo.ai.studymate.service.document;

import com.flamingo.ai.studymate.domain.entity.Document;
import com.flamingo.ai.studymate.domain.repository.DocumentRepository;
import com.flamingo.ai.studymate.elasticsearch.DocumentChunk;
import com.flamingo.ai.studymate.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.studymate.exception.DocumentProcessingException;
import com.flamingo.ai.studymate.service.rag.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Chunks, embeds and indexes a stored document.
 *
 * <p>A failure marks the document {@code FAILED}; its pages stay available for navigation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIndexingService {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;
  private final DocumentChunkIndexService documentChunkIndexService;
  private final EmbeddingService embeddingService;
  private final TextChunker textChunker;
  private final MeterRegistry meterRegistry;

  @Async("documentIndexingExecutor")
  public void indexDocumentAsync(UUID documentId) {
    indexDocument(documentId);
  }

  /** Indexes the document and records the outcome on its row. Never throws. */
  @Timed(value = "document.index", description = "Time to chunk, embed and index a document")
  public void indexDocument(UUID documentId) {
    try {
      Document document =
          documentRepository
              .findById(documentId)
              .orElseThrow(
                  () ->
                      new DocumentProcessingException(
                          documentId, "Document not found", "Document not found"));

      List<TextChunk> textChunks = textChunker.chunk(document.getContent(), document.getPages());
      if (textChunks.isEmpty()) {
        throw new DocumentProcessingException(
            documentId, "No text to index", "The document has no text content");
      }
      log.debug("Document {} split into {} chunks", documentId, textChunks.size());

      List<List<Float>> embeddings =
          embeddingService.embedDocuments(textChunks.stream().map(TextChunk::content).toList());
      if (embeddings.size() != textChunks.size()) {
        throw new DocumentProcessingException(
            documentId,
            String.format(
                "Embedding generation failed: expected %d embeddings, got %d",
                textChunks.size(), embeddings.size()),
            "Failed to embed document");
      }

      UUID sessionId = document.getSession() != null ? document.getSession().getId() : null;
      List<DocumentChunk> chunks = new ArrayList<>(textChunks.size());
      for (int i = 0; i < textChunks.size(); i++) {
        TextChunk textChunk = textChunks.get(i);
        List<Float> embedding = embeddings.get(i);
        if (embedding == null || embedding.isEmpty()) {
          throw new DocumentProcessingException(
              documentId, "Empty embedding for chunk " + i, "Failed to embed document");
        }
        chunks.add(
            DocumentChunk.builder()
                .id(documentId + "_" + textChunk.index())
                .documentId(documentId)
                .sessionId(sessionId)
                .documentTitle(document.getTitle())
                .chunkIndex(textChunk.index())
                .pageNumber(textChunk.pageNumber())
                .language(document.getLanguage())
                .content(textChunk.content())
                .embedding(embedding)
                .build());
      }

      documentChunkIndexService.indexDocuments(chunks);
      updateWithRetry(documentId, indexed -> indexed.markIndexed(chunks.size()));
      meterRegistry.counter("document.indexing.success").increment();
      log.info("Indexed document {} ({} chunks)", documentId, chunks.size());

    } catch (Exception e) {
      log.error("Failed to index document {}: {}", documentId, e.getMessage(), e);
      meterRegistry.counter("document.indexing.failure").increment();
      try {
        updateWithRetry(documentId, failed -> failed.markFailed(e.getMessage()));
      } catch (Exception statusEx) {
        log.error(
            "Failed to record indexing failure of document {}: {}",
            documentId,
            statusEx.getMessage());
      }
    }
  }

  /** Applies a status change, retrying on SQLite lock contention. */
  private void updateWithRetry(UUID documentId, Consumer<Document> change) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        Document document =
            documentRepository
                .findById(documentId)
                .orElseThrow(
                    () ->
                        new DocumentProcessingException(
                            documentId, "Document not found", "Document not found"));
        change.accept(document);
        documentRepository.saveAndFlush(document);
        return;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
