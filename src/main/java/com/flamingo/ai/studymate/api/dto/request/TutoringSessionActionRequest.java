package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a tutoring session action: start, continue, end or load_context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutoringSessionActionRequest {

  @NotBlank(message = "Action is required")
  private String action;

  private String learnerId;

  /** Guest requests only: text the guest profile is inferred from. */
  private String query;
}
