package com.flamingo.ai.studymate.api.rest;

import com.flamingo.ai.studymate.api.dto.request.CreateLearnerRequest;
import com.flamingo.ai.studymate.api.dto.request.LearnerModelUpdateRequest;
import com.flamingo.ai.studymate.api.dto.response.LearnerProfileResponse;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.service.tutoring.LearnerModelManager;
import com.flamingo.ai.studymate.service.tutoring.LearnerProfileService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for durable learner profiles and their learner model. */
@RestController
@RequestMapping("/api/learners")
@RequiredArgsConstructor
public class LearnerController {

  private final LearnerProfileService learnerProfileService;
  private final LearnerModelManager learnerModelManager;

  @PostMapping
  public ResponseEntity<LearnerProfileResponse> createLearner(
      @Valid @RequestBody CreateLearnerRequest request) {
    LearnerProfile profile = learnerProfileService.createProfile(request);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(LearnerProfileResponse.fromEntity(profile));
  }

  @GetMapping("/{learnerId}")
  public ResponseEntity<LearnerProfileResponse> getLearner(@PathVariable String learnerId) {
    return ResponseEntity.ok(
        LearnerProfileResponse.fromEntity(learnerProfileService.getProfile(learnerId)));
  }

  /** Applies a learner model update and returns its outcome message. */
  @PostMapping("/{learnerId}/model")
  public ResponseEntity<Map<String, String>> updateModel(
      @PathVariable String learnerId, @Valid @RequestBody LearnerModelUpdateRequest request) {
    String message =
        learnerModelManager.update(learnerId, request.getUpdateType(), request.getData());
    return ResponseEntity.ok(Map.of("message", message));
  }
}
