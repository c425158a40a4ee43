package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the explanation and practice endpoints. The request is free text ("explain
 * photosynthesis step by step", "5 hard quiz questions on fractions") or a JSON object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutoringTextRequest {

  @NotBlank(message = "Request is required")
  @Size(max = 10000, message = "Request must not exceed 10000 characters")
  private String request;

  private String learnerId;
}
