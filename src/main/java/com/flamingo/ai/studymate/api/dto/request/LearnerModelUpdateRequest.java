package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a learner model update. {@code updateType} is one of performance,
 * mastered_topic, struggle or preferences; {@code data} is key=value pairs or JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearnerModelUpdateRequest {

  @NotBlank(message = "Update type is required")
  private String updateType;

  @NotBlank(message = "Update data is required")
  private String data;
}
