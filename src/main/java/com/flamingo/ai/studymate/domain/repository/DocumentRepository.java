package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.Document;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds all documents for a session, newest first. */
  List<Document> findBySessionIdOrderByUploadedAtDesc(UUID sessionId);

  /** Most recently uploaded document of a session. */
  Optional<Document> findFirstBySessionIdOrderByUploadedAtDesc(UUID sessionId);

  /** Most recently uploaded document overall. */
  Optional<Document> findFirstByOrderByUploadedAtDesc();

  /** Newest document of a session whose title contains the given text. */
  Optional<Document> findFirstBySessionIdAndTitleContainingIgnoreCaseOrderByUploadedAtDesc(
      UUID sessionId, String title);

  /** Newest document overall whose title contains the given text. */
  Optional<Document> findFirstByTitleContainingIgnoreCaseOrderByUploadedAtDesc(String title);

  /** Counts documents by session. */
  long countBySessionId(UUID sessionId);
}
