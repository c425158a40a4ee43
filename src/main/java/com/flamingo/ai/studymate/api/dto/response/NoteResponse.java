package com.flamingo.ai.studymate.api.dto.response;

import com.flamingo.ai.studymate.domain.entity.Note;
import java.time.LocalDateTime;
import java.util.UUID;

/** Response DTO for a note. */
public record NoteResponse(
    UUID id, UUID documentId, Integer pageNumber, String content, LocalDateTime createdAt) {

  public static NoteResponse fromEntity(Note note) {
    return new NoteResponse(
        note.getId(),
        note.getDocumentId(),
        note.getPageNumber(),
        note.getContent(),
        note.getCreatedAt());
  }
}
