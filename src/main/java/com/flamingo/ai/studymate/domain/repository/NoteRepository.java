package com.flamingo.ai.studymate.domain.repository;

import com.flamingo.ai.studymate.domain.entity.Note;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Note entities. */
@Repository
public interface NoteRepository extends JpaRepository<Note, UUID> {

  List<Note> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

  List<Note> findBySessionIdAndPageNumberOrderByCreatedAtAsc(UUID sessionId, Integer pageNumber);
}
