package com.flamingo.ai.studymate.service.document;

import com.flamingo.ai.studymate.api.dto.request.CreateDocumentRequest;
import com.flamingo.ai.studymate.domain.entity.Document;
import com.flamingo.ai.studymate.domain.entity.Session;
import com.flamingo.ai.studymate.domain.repository.DocumentRepository;
import com.flamingo.ai.studymate.exception.DocumentNotFoundException;
import com.flamingo.ai.studymate.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Implementation of the DocumentService. */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final Pattern ARABIC = Pattern.compile("\\p{InArabic}");
  private static final Pattern PAGE_KEY = Pattern.compile("\\d+");

  private final DocumentRepository documentRepository;
  private final SessionService sessionService;
  private final MeterRegistry meterRegistry;
  private final DocumentIndexingService documentIndexingService;

  public DocumentServiceImpl(
      DocumentRepository documentRepository,
      SessionService sessionService,
      MeterRegistry meterRegistry,
      @Lazy DocumentIndexingService documentIndexingService) {
    this.documentRepository = documentRepository;
    this.sessionService = sessionService;
    this.meterRegistry = meterRegistry;
    this.documentIndexingService = documentIndexingService;
  }

  @Override
  @Transactional
  @Timed(value = "document.create", description = "Time to store a document")
  public Document createDocument(CreateDocumentRequest request) {
    Session session =
        request.getSessionId() != null ? sessionService.getSession(request.getSessionId()) : null;

    Map<String, String> pages = normalizePages(request.getPages());
    String content = request.getContent();
    if (content == null || content.isBlank()) {
      content = String.join("\n\n", pages.values());
    }
    if (content.isBlank()) {
      throw new IllegalArgumentException("Document content or pages are required");
    }
    if (pages.isEmpty()) {
      pages.put("1", content);
    }

    String language =
        request.getLanguage() != null && !request.getLanguage().isBlank()
            ? request.getLanguage()
            : detectLanguage(content);

    Map<String, Object> metadata = new LinkedHashMap<>();
    if (request.getMetadata() != null) {
      metadata.putAll(request.getMetadata());
    }
    metadata.put("language", language);
    if (request.getSourcePath() != null) {
      metadata.put("source_path", request.getSourcePath());
    }

    Document saved =
        documentRepository.save(
            Document.builder()
                .session(session)
                .title(request.getTitle().strip())
                .content(content)
                .pages(pages)
                .metadata(metadata)
                .language(language)
                .sourcePath(request.getSourcePath())
                .build());
    meterRegistry.counter("document.created", "language", language).increment();

    // index after commit so the indexing thread sees the row
    UUID documentId = saved.getId();
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              documentIndexingService.indexDocumentAsync(documentId);
            }
          });
    } else {
      documentIndexingService.indexDocumentAsync(documentId);
    }

    log.info(
        "Stored document '{}' with ID {} ({} pages, session {})",
        saved.getTitle(),
        documentId,
        pages.size(),
        session != null ? session.getId() : null);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.getBySession", description = "Time to get documents by session")
  public List<Document> getDocumentsBySession(UUID sessionId) {
    sessionService.getSession(sessionId);
    return documentRepository.findBySessionIdOrderByUploadedAtDesc(sessionId);
  }

  /** Keeps pages with numeric keys and non-null text. */
  private static Map<String, String> normalizePages(Map<String, String> pages) {
    Map<String, String> normalized = new LinkedHashMap<>();
    if (pages == null) {
      return normalized;
    }
    numericKeys(pages).forEach((number, text) -> normalized.put(String.valueOf(number), text));
    return normalized;
  }

  private static Map<Integer, String> numericKeys(Map<String, String> pages) {
    Map<Integer, String> numbered = new TreeMap<>();
    pages.forEach(
        (key, text) -> {
          if (key != null && PAGE_KEY.matcher(key.strip()).matches() && text != null) {
            numbered.put(Integer.parseInt(key.strip()), text);
          }
        });
    return numbered;
  }

  static String detectLanguage(String text) {
    return ARABIC.matcher(text).find() ? "ar" : "en";
  }
}
