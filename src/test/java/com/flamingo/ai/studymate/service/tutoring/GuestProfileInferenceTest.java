package com.flamingo.ai.studymate.service.tutoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import com.flamingo.ai.studymate.service.tutoring.GuestProfileInference.InferredProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("GuestProfileInference Tests")
class GuestProfileInferenceTest {

  private final GuestProfileInference inference = new GuestProfileInference();

  @Test
  @DisplayName("Should infer a visual grade-8 profile from a 'show me' request")
  void shouldInferVisualDefaultGrade() {
    InferredProfile inferred =
        inference.infer("guest_1700000000000", "Show me how to solve quadratic equations");

    LearnerProfile profile = inferred.profile();
    assertThat(profile.getLearningStyle()).isEqualTo(LearningStyle.VISUAL);
    assertThat(profile.getGradeLevel()).isEqualTo(8);
    assertThat(profile.getDifficultyPreference()).isEqualTo("medium");
    assertThat(profile.getPreferredLanguage()).isEqualTo("English");
    assertThat(profile.isGuestSession()).isTrue();
    assertThat(inferred.indicators().get("learning_style_indicators")).contains("visual:show");
  }

  @Test
  @DisplayName("Should prefer an explicit grade and detect struggling learners")
  void shouldUseExplicitGrade() {
    LearnerProfile profile =
        inference.infer("guest_1", "I'm in 5th grade and confused about fractions").profile();

    assertThat(profile.getGradeLevel()).isEqualTo(5);
    assertThat(profile.getDifficultyPreference()).isEqualTo("easy");
  }

  @Test
  @DisplayName("Should read subject level, style and difficulty together")
  void shouldInferHighSchoolAuditoryChallenging() {
    LearnerProfile profile =
        inference.infer("guest_2", "Explain calculus derivatives in a rigorous way").profile();

    assertThat(profile.getGradeLevel()).isEqualTo(11);
    assertThat(profile.getLearningStyle()).isEqualTo(LearningStyle.AUDITORY);
    assertThat(profile.getDifficultyPreference()).isEqualTo("challenging");
  }

  @ParameterizedTest
  @CsvSource({
    "'Can you teach me counting', 1",
    "'help with addition', 4",
    "'simple fraction practice', 4",
    "'university level complex analysis', 16",
    "'what is a fraction', 8",
    "'my ap biology homework', 11",
    "'label the map of europe', 11"
  })
  @DisplayName("Grade rules should apply in order")
  void shouldApplyGradeRulesInOrder(String query, int expectedGrade) {
    assertThat(GuestProfileInference.inferGrade(query.toLowerCase())).isEqualTo(expectedGrade);
  }

  @Test
  @DisplayName("Should report grade, style and difficulty cues found in the query")
  void shouldReportAllIndicatorGroups() {
    InferredProfile inferred =
        inference.infer(
            "guest_5", "I'm confused, can you analyze this in a creative way with basic algebra");

    assertThat(inferred.indicators())
        .containsOnlyKeys(
            "grade_level_indicators", "learning_style_indicators", "difficulty_indicators");
    assertThat(inferred.indicators().get("grade_level_indicators"))
        .containsExactly("elementary:basic", "middle:algebra");
    assertThat(inferred.indicators().get("learning_style_indicators"))
        .containsExactly("analytical:analyze", "creative:creative");
    assertThat(inferred.indicators().get("difficulty_indicators"))
        .containsExactly("easy:basic", "easy:confused");
    assertThat(inferred.profile().getLearningStyle()).isEqualTo(LearningStyle.ANALYTICAL);
  }

  @Test
  @DisplayName("Should mark challenging requests with hard cues")
  void shouldReportHardDifficultyIndicators() {
    InferredProfile inferred =
        inference.infer("guest_6", "Give me a rigorous, in-depth proof");

    assertThat(inferred.indicators().get("difficulty_indicators"))
        .containsExactly("hard:in-depth", "hard:rigorous");
    assertThat(inferred.profile().getDifficultyPreference()).isEqualTo("challenging");
  }

  @Test
  @DisplayName("Should detect Spanish from the original-case query")
  void shouldDetectSpanish() {
    LearnerProfile profile = inference.infer("guest_3", "Ayúdame con álgebra por favor").profile();

    assertThat(profile.getPreferredLanguage()).isEqualTo("Spanish");
  }

  @Test
  @DisplayName("Should fall back to defaults for an empty query")
  void shouldUseDefaults_forEmptyQuery() {
    LearnerProfile profile = inference.infer("guest_4", null).profile();

    assertThat(profile.getGradeLevel()).isEqualTo(GuestProfileInference.DEFAULT_GRADE);
    assertThat(profile.getLearningStyle()).isEqualTo(LearningStyle.MIXED);
  }
}
