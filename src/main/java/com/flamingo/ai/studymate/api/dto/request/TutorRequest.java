package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the tutoring endpoints. A missing learner id makes the request a guest
 * interaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorRequest {

  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  private String learnerId;

  /** Answer already produced by the content agent, if the request was delegated. */
  private String contentAnswer;

  private String previousQuery;
}
