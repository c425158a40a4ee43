package com.flamingo.ai.studymate.service.document;

import com.flamingo.ai.studymate.api.dto.request.CreateDocumentRequest;
import com.flamingo.ai.studymate.domain.entity.Document;
import java.util.List;
import java.util.UUID;

/** Service interface for document management. */
public interface DocumentService {

  /**
   * Stores a text document and schedules its indexing after the transaction commits.
   *
   * @param request title, text or pages, and the optional owning session
   * @return the stored document, status {@code PENDING}
   * @throws com.flamingo.ai.studymate.exception.SessionNotFoundException if the session is unknown
   */
  Document createDocument(CreateDocumentRequest request);

  /**
   * Gets a document by ID.
   *
   * @throws com.flamingo.ai.studymate.exception.DocumentNotFoundException if not found
   */
  Document getDocument(UUID documentId);

  /** Documents of a session, newest first. */
  List<Document> getDocumentsBySession(UUID sessionId);
}
