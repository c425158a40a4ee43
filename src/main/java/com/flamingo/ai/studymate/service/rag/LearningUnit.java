package com.flamingo.ai.studymate.service.rag;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Schema-constrained answer shape used for structured lessons. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LearningUnit(
    String title,
    List<String> subtopics,
    @JsonProperty("detailed_explanation") String detailedExplanation,
    @JsonProperty("key_points") List<String> keyPoints,
    @JsonProperty("difficulty_level") String difficultyLevel,
    @JsonProperty("learning_objectives") List<String> learningObjectives,
    List<String> keywords) {

  static LearningUnit error(String message) {
    return new LearningUnit(
        "Error in Processing",
        List.of("Error handling"),
        message,
        List.of(message),
        "easy",
        List.of("Understand error occurred"),
        List.of("error"));
  }

  /** Text recorded as the turn's answer and replayed as history. */
  String answerText() {
    return title + ": " + detailedExplanation;
  }
}
