package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.Bookmark;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Bookmark entities. */
@Repository
public interface BookmarkRepository extends JpaRepository<Bookmark, UUID> {

  List<Bookmark> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

  Optional<Bookmark> findBySessionIdAndDocumentIdAndPageNumber(
      UUID sessionId, UUID documentId, Integer pageNumber);
}
