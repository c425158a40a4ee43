package com.flamingo.ai.studymate.api.dto.request;

import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for registering a learner. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateLearnerRequest {

  /** Optional caller-chosen id; generated when absent. Guest-prefixed ids are rejected. */
  @Pattern(regexp = "^(?!guest_).*$", message = "Learner id must not start with guest_")
  @Size(max = 100, message = "Learner id must be at most 100 characters")
  private String id;

  @NotBlank(message = "Name is required")
  @Size(max = 255, message = "Name must be at most 255 characters")
  private String name;

  @Min(value = 1, message = "Grade level must be at least 1")
  @Max(value = 16, message = "Grade level must be at most 16")
  private Integer gradeLevel;

  private LearningStyle learningStyle;

  private String preferredLanguage;

  @Pattern(
      regexp = "^(easy|medium|challenging)$",
      message = "Difficulty preference must be easy, medium or challenging")
  private String difficultyPreference;

  private Map<String, Object> preferences;
}
