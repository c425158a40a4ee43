package com.flamingo.ai.studymate.service.tutoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.agent.PracticeAgent;
import com.flamingo.ai.studymate.config.TutoringConfig;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.PracticeDifficulty;
import com.flamingo.ai.studymate.domain.enums.PracticeType;
import com.flamingo.ai.studymate.service.routing.JsonBlockExtractor;
import com.flamingo.ai.studymate.service.tutoring.PracticeGenerator.PracticeRequest;
import com.flamingo.ai.studymate.service.tutoring.PracticeGenerator.PracticeSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("PracticeGenerator Tests")
class PracticeGeneratorTest {

  @Mock private PracticeAgent practiceAgent;

  private SimpleMeterRegistry meterRegistry;
  private PracticeGenerator generator;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    meterRegistry = new SimpleMeterRegistry();
    generator =
        new PracticeGenerator(
            practiceAgent,
            new JsonBlockExtractor(objectMapper),
            objectMapper,
            new TutoringConfig(),
            meterRegistry);
  }

  @Nested
  @DisplayName("Request parsing")
  class RequestParsing {

    @Test
    @DisplayName("Should read topic, type, count and difficulty from natural language")
    void shouldParseNaturalLanguage() {
      PracticeRequest request =
          generator
              .parseRequest("Create a quiz on photosynthesis with 30 questions, hard")
              .orElseThrow();

      assertThat(request.topic()).isEqualTo("photosynthesis");
      assertThat(request.type()).isEqualTo(PracticeType.QUIZ);
      assertThat(request.itemCount()).isEqualTo(PracticeGenerator.MAX_ITEMS);
      assertThat(request.requestedDifficulty()).isEqualTo(PracticeDifficulty.HARD);
      assertThat(request.includeAnswers()).isTrue();
    }

    @Test
    @DisplayName("Should accept a JSON request")
    void shouldParseJson() {
      PracticeRequest request =
          generator
              .parseRequest(
                  "{\"topic\": \"fractions\", \"practice_type\": \"flashcards\","
                      + " \"num_items\": 2, \"include_answers\": false}")
              .orElseThrow();

      assertThat(request.topic()).isEqualTo("fractions");
      assertThat(request.type()).isEqualTo(PracticeType.FLASHCARDS);
      assertThat(request.itemCount()).isEqualTo(2);
      assertThat(request.requestedDifficulty()).isNull();
      assertThat(request.includeAnswers()).isFalse();
    }

    @Test
    @DisplayName("Should reject a blank request")
    void shouldRejectBlank() {
      assertThat(generator.generate(" ", null).valid()).isFalse();
    }
  }

  @Nested
  @DisplayName("Difficulty selection")
  class DifficultySelection {

    @Test
    @DisplayName("Requested difficulty and stored preferences should come first")
    void shouldPreferRequestAndStoredPreference() {
      LearnerProfile profile =
          LearnerProfile.builder().preferences(Map.of("practice_difficulty", "hard")).build();

      assertThat(PracticeGenerator.selectDifficulty(profile, PracticeDifficulty.EASY))
          .isEqualTo(PracticeDifficulty.EASY);
      assertThat(PracticeGenerator.selectDifficulty(profile, null))
          .isEqualTo(PracticeDifficulty.HARD);
      assertThat(
              PracticeGenerator.selectDifficulty(
                  LearnerProfile.builder().difficultyPreference("challenging").build(), null))
          .isEqualTo(PracticeDifficulty.HARD);
    }

    @Test
    @DisplayName("Struggles should make practice easy")
    void shouldUseEasy_whenStruggling() {
      LearnerProfile profile =
          LearnerProfile.builder()
              .gradeLevel(11)
              .accuracyRate(0.95)
              .learningStruggles(List.of(Map.of("topic", "vectors")))
              .build();

      assertThat(PracticeGenerator.selectDifficulty(profile, null))
          .isEqualTo(PracticeDifficulty.EASY);
    }

    @Test
    @DisplayName("Accuracy should shift the grade baseline one level")
    void shouldAdjustBaselineByAccuracy() {
      assertThat(
              PracticeGenerator.selectDifficulty(
                  LearnerProfile.builder().gradeLevel(5).accuracyRate(0.7).build(), null))
          .isEqualTo(PracticeDifficulty.EASY);
      assertThat(
              PracticeGenerator.selectDifficulty(
                  LearnerProfile.builder().gradeLevel(10).accuracyRate(0.9).build(), null))
          .isEqualTo(PracticeDifficulty.HARD);
      assertThat(
              PracticeGenerator.selectDifficulty(
                  LearnerProfile.builder().gradeLevel(10).accuracyRate(0.5).build(), null))
          .isEqualTo(PracticeDifficulty.EASY);
      assertThat(PracticeGenerator.selectDifficulty(null, null))
          .isEqualTo(PracticeDifficulty.MEDIUM);
    }
  }

  @Test
  @DisplayName("Should keep the items the agent returns")
  void shouldUseAgentItems() {
    // Given
    when(practiceAgent.generate(
            eq("photosynthesis"), eq("quiz"), eq("hard"), anyInt(), anyBoolean(), anyString()))
        .thenReturn(
            "{\"items\": [{\"question\": \"What do plants need?\", \"answer\": \"Light\"},"
                + " {\"question\": \"Where does it happen?\"}]}");

    // When
    PracticeSet set =
        generator.generate("Create a quiz on photosynthesis with 2 questions, hard", null);

    // Then
    assertThat(set.fallback()).isFalse();
    assertThat(set.items()).hasSize(2);
    assertThat(set.items().get(0).id()).isEqualTo("item_1");
    assertThat(set.formatted())
        .startsWith("**Quiz - Hard Difficulty**\n*2 items generated*")
        .contains("   *Answer:* Light");
  }

  @Test
  @DisplayName("Should fall back to at most three template items when the agent fails")
  void shouldFallBack_whenAgentFails() {
    // Given
    when(practiceAgent.generate(
            anyString(), anyString(), anyString(), anyInt(), anyBoolean(), anyString()))
        .thenThrow(new RuntimeException("model unavailable"));

    // When
    PracticeSet set = generator.generate("algebra practice problems", null);

    // Then
    assertThat(set.fallback()).isTrue();
    assertThat(set.items()).hasSize(PracticeGenerator.MAX_FALLBACK_ITEMS);
    assertThat(set.items().get(0).question()).startsWith("Practice question 1 about algebra");
    assertThat(meterRegistry.counter("tutoring.fallback", "stage", "practice").count())
        .isEqualTo(1.0);
  }
}
