package com.flamingo.ai.studymate.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One learner interaction to log. Required fields are checked by the logger so that a missing
 * field is reported in the result message rather than as a validation error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogInteractionRequest {

  @JsonAlias("interaction_type")
  private String interactionType;

  @JsonAlias("query_text")
  private String queryText;

  @JsonAlias("response_text")
  private String responseText;

  @JsonAlias("was_helpful")
  private Boolean wasHelpful;

  /** 1 to 5; values outside the range are dropped. */
  @JsonAlias("difficulty_rating")
  private Integer difficultyRating;

  @JsonAlias("response_time_seconds")
  private Double responseTimeSeconds;

  @JsonAlias("adaptation_requested")
  private String adaptationRequested;

  @JsonAlias("learning_unit_id")
  private String learningUnitId;

  private Map<String, Object> metadata;
}
