package com.flamingo.ai.studymate.api.dto.request;

import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a session. Both fields are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

  @Size(max = 255, message = "Title must be at most 255 characters")
  private String title;

  private Map<String, Object> metadata;
}
