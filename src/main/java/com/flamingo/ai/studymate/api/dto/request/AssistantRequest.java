package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one assistant turn. A blank utterance is accepted and answered gracefully. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantRequest {

  @NotNull(message = "Utterance is required")
  @Size(max = 10000, message = "Utterance must not exceed 10000 characters")
  private String utterance;

  /** Document the caller has in view, if any. */
  private UUID documentId;

  /** Durable learner id for tutoring; absent means guest. */
  private String learnerId;
}
