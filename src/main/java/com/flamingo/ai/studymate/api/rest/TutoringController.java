package com.flamingo.ai.studymate.api.rest;

import com.flamingo.ai.studymate.api.dto.request.LogInteractionRequest;
import com.flamingo.ai.studymate.api.dto.request.TutorRequest;
import com.flamingo.ai.studymate.api.dto.request.TutoringSessionActionRequest;
import com.flamingo.ai.studymate.api.dto.request.TutoringTextRequest;
import com.flamingo.ai.studymate.service.tutoring.ExplanationEngine.ExplanationResult;
import com.flamingo.ai.studymate.service.tutoring.InteractionLogger;
import com.flamingo.ai.studymate.service.tutoring.InteractionLogger.InteractionLogResult;
import com.flamingo.ai.studymate.service.tutoring.PracticeGenerator.PracticeSet;
import com.flamingo.ai.studymate.service.tutoring.TutorAgentService;
import com.flamingo.ai.studymate.service.tutoring.TutorResponse;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the adaptive tutoring layer. A missing learner id means a guest. */
@RestController
@RequestMapping("/api/tutoring")
@RequiredArgsConstructor
public class TutoringController {

  private final TutorAgentService tutorAgentService;
  private final InteractionLogger interactionLogger;

  /** Runs a session action: start, continue, end or load_context. */
  @PostMapping("/sessions")
  public ResponseEntity<TutorResponse> manageSession(
      @Valid @RequestBody TutoringSessionActionRequest request) {
    return ResponseEntity.ok(
        tutorAgentService.manageSession(
            request.getAction(), request.getLearnerId(), request.getQuery()));
  }

  /** Logs an interaction; rejected input is reported in the body, not as an error status. */
  @PostMapping("/sessions/{tutoringSessionId}/interactions")
  public ResponseEntity<InteractionLogResult> logInteraction(
      @PathVariable UUID tutoringSessionId, @RequestBody LogInteractionRequest request) {
    return ResponseEntity.ok(interactionLogger.log(tutoringSessionId, request));
  }

  @PostMapping("/ask")
  public ResponseEntity<TutorResponse> ask(@Valid @RequestBody TutorRequest request) {
    return ResponseEntity.ok(tutorAgentService.tutor(request));
  }

  @PostMapping("/explanations")
  public ResponseEntity<ExplanationResult> explain(
      @Valid @RequestBody TutoringTextRequest request) {
    return ResponseEntity.ok(
        tutorAgentService.explain(request.getLearnerId(), request.getRequest()));
  }

  @PostMapping("/practice")
  public ResponseEntity<PracticeSet> practice(@Valid @RequestBody TutoringTextRequest request) {
    return ResponseEntity.ok(
        tutorAgentService.practice(request.getLearnerId(), request.getRequest()));
  }
}
