package com.flamingo.ai.studymate.api.rest;

import com.flamingo.ai.studymate.api.dto.request.CreateSessionRequest;
import com.flamingo.ai.studymate.api.dto.response.NoteResponse;
import com.flamingo.ai.studymate.api.dto.response.SessionResponse;
import com.flamingo.ai.studymate.api.dto.response.SessionWithStats;
import com.flamingo.ai.studymate.domain.entity.Session;
import com.flamingo.ai.studymate.domain.repository.NoteRepository;
import com.flamingo.ai.studymate.service.session.SessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for session management. */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionService sessionService;
  private final NoteRepository noteRepository;

  /** Creates a new session. */
  @PostMapping
  public ResponseEntity<SessionResponse> createSession(
      @Valid @RequestBody(required = false) CreateSessionRequest request) {
    Session session = sessionService.createSession(request);
    // new session has no documents and no turns
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SessionResponse.fromEntity(session, 0, 0));
  }

  /** Gets all sessions, most recently accessed first. */
  @GetMapping
  public ResponseEntity<List<SessionResponse>> getAllSessions() {
    List<SessionResponse> responses =
        sessionService.getAllSessionsWithStats().stream()
            .map(SessionWithStats::toResponse)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a session by ID. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> getSession(@PathVariable UUID sessionId) {
    sessionService.touchSession(sessionId);
    return ResponseEntity.ok(sessionService.getSessionWithStats(sessionId).toResponse());
  }

  /** Patches session metadata; keys mapped to null are removed. */
  @PatchMapping("/{sessionId}/metadata")
  public ResponseEntity<SessionResponse> patchMetadata(
      @PathVariable UUID sessionId, @RequestBody Map<String, Object> patch) {
    sessionService.patchMetadata(sessionId, patch);
    return ResponseEntity.ok(sessionService.getSessionWithStats(sessionId).toResponse());
  }

  /** Lists the notes of a session, optionally for one page. */
  @GetMapping("/{sessionId}/notes")
  public ResponseEntity<List<NoteResponse>> getNotes(
      @PathVariable UUID sessionId, @RequestParam(required = false) Integer page) {
    sessionService.getSession(sessionId);
    List<NoteResponse> notes =
        (page != null
                ? noteRepository.findBySessionIdAndPageNumberOrderByCreatedAtAsc(sessionId, page)
                : noteRepository.findBySessionIdOrderByCreatedAtAsc(sessionId))
            .stream().map(NoteResponse::fromEntity).toList();
    return ResponseEntity.ok(notes);
  }
}
