package com.flamingo.ai.studymate.api.rest;

import com.flamingo.ai.studymate.api.dto.request.AssistantRequest;
import com.flamingo.ai.studymate.service.assistant.AssistantReply;
import com.flamingo.ai.studymate.service.assistant.AssistantService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single conversational entry point: an utterance goes in, the routing trace and the handler
 * result come out. Soft outcomes (no document, end of document, ...) are 200 responses carrying a
 * status; only unknown sessions and infrastructure failures map to error codes.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AssistantController {

  private final AssistantService assistantService;

  @PostMapping("/sessions/{sessionId}/assistant")
  public ResponseEntity<AssistantReply> handleInSession(
      @PathVariable UUID sessionId, @Valid @RequestBody AssistantRequest request) {
    return ResponseEntity.ok(
        assistantService.handle(
            sessionId, request.getUtterance(), request.getDocumentId(), request.getLearnerId()));
  }

  @PostMapping("/assistant")
  public ResponseEntity<AssistantReply> handle(@Valid @RequestBody AssistantRequest request) {
    return ResponseEntity.ok(
        assistantService.handle(
            null, request.getUtterance(), request.getDocumentId(), request.getLearnerId()));
  }
}
