package com.flamingo.ai.studymate.service.tutoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymate.api.dto.request.LogInteractionRequest;
import com.flamingo.ai.studymate.config.TutoringConfig;
import com.flamingo.ai.studymate.domain.entity.LearnerInteraction;
import com.flamingo.ai.studymate.domain.entity.TutoringSession;
import com.flamingo.ai.studymate.domain.enums.InteractionType;
import com.flamingo.ai.studymate.domain.repository.LearnerInteractionRepository;
import com.flamingo.ai.studymate.domain.repository.TutoringSessionRepository;
import com.flamingo.ai.studymate.exception.TutoringSessionNotFoundException;
import com.flamingo.ai.studymate.service.tutoring.InteractionLogger.InteractionLogResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("InteractionLogger Tests")
class InteractionLoggerTest {

  @Mock private LearnerInteractionRepository learnerInteractionRepository;
  @Mock private TutoringSessionRepository tutoringSessionRepository;

  private TutoringConfig tutoringConfig;
  private SimpleMeterRegistry meterRegistry;
  private InteractionLogger interactionLogger;
  private TutoringSession session;

  @BeforeEach
  void setUp() {
    tutoringConfig = new TutoringConfig();
    meterRegistry = new SimpleMeterRegistry();
    interactionLogger =
        new InteractionLogger(
            learnerInteractionRepository, tutoringSessionRepository, tutoringConfig, meterRegistry);

    session = TutoringSession.builder().id(UUID.randomUUID()).learnerId("student-42").build();
    when(tutoringSessionRepository.findById(session.getId())).thenReturn(Optional.of(session));
    when(learnerInteractionRepository.save(any(LearnerInteraction.class)))
        .thenAnswer(
            inv -> {
              LearnerInteraction interaction = inv.getArgument(0);
              interaction.setId(UUID.randomUUID());
              return interaction;
            });
  }

  private LogInteractionRequest request(String type, Integer rating) {
    return LogInteractionRequest.builder()
        .interactionType(type)
        .queryText("What is 3/4 + 1/4?")
        .responseText("It is 1.")
        .difficultyRating(rating)
        .build();
  }

  @Test
  @DisplayName("Should save the interaction and update session progress")
  void shouldLogInteractionAndUpdateProgress() {
    // When
    InteractionLogResult result = interactionLogger.log(session.getId(), request("practice", 3));

    // Then
    assertThat(result.logged()).isTrue();
    assertThat(result.message()).contains("Difficulty: 3/5");

    ArgumentCaptor<LearnerInteraction> captor = ArgumentCaptor.forClass(LearnerInteraction.class);
    verify(learnerInteractionRepository).save(captor.capture());
    assertThat(captor.getValue().getInteractionType()).isEqualTo(InteractionType.PRACTICE);
    assertThat(captor.getValue().getLearnerId()).isEqualTo("student-42");

    @SuppressWarnings("unchecked")
    Map<String, Object> progress =
        (Map<String, Object>) session.getSessionState().get(InteractionLogger.LEARNING_PROGRESS);
    assertThat(progress)
        .containsEntry("practice_count", 1)
        .containsEntry("total_interactions", 1)
        .containsEntry("difficulty_ratings", List.of(3));
    assertThat(session.getInteractionHistory()).hasSize(1);
    assertThat(meterRegistry.counter("tutoring.interactions", "type", "practice").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should drop a difficulty rating outside 1-5 but still log")
  void shouldIgnoreOutOfRangeRating() {
    // When
    InteractionLogResult result = interactionLogger.log(session.getId(), request("question", 9));

    // Then
    assertThat(result.logged()).isTrue();
    ArgumentCaptor<LearnerInteraction> captor = ArgumentCaptor.forClass(LearnerInteraction.class);
    verify(learnerInteractionRepository).save(captor.capture());
    assertThat(captor.getValue().getDifficultyRating()).isNull();
  }

  @Test
  @DisplayName("Should keep only the most recent history entries and ratings")
  void shouldCapHistoryAndRatings() {
    // Given
    tutoringConfig.setHistoryLimit(2);
    tutoringConfig.setDifficultyRatingsLimit(2);

    // When
    interactionLogger.log(session.getId(), request("question", 1));
    interactionLogger.log(session.getId(), request("hint", 2));
    interactionLogger.log(session.getId(), request("feedback", 4));

    // Then
    assertThat(session.getInteractionHistory())
        .extracting(entry -> entry.get("type"))
        .containsExactly("hint", "feedback");
    @SuppressWarnings("unchecked")
    Map<String, Object> progress =
        (Map<String, Object>) session.getSessionState().get(InteractionLogger.LEARNING_PROGRESS);
    assertThat(progress)
        .containsEntry("difficulty_ratings", List.of(2, 4))
        .containsEntry("total_interactions", 3);
  }

  @Test
  @DisplayName("Should truncate long texts in the history summary")
  void shouldTruncateSummaryText() {
    // Given
    LogInteractionRequest longRequest =
        LogInteractionRequest.builder()
            .interactionType("explanation")
            .queryText("q".repeat(250))
            .responseText("short")
            .build();

    // When
    interactionLogger.log(session.getId(), longRequest);

    // Then
    String query = (String) session.getInteractionHistory().get(0).get("query");
    assertThat(query).hasSize(203).endsWith("...");
  }

  @Test
  @DisplayName("Should reject missing fields without writing")
  void shouldRejectMissingFields() {
    // When
    InteractionLogResult result =
        interactionLogger.log(
            session.getId(), LogInteractionRequest.builder().interactionType("hint").build());

    // Then
    assertThat(result.logged()).isFalse();
    assertThat(result.message()).isEqualTo("Missing required fields: query_text, response_text");
    verify(learnerInteractionRepository, never()).save(any());
  }

  @Test
  @DisplayName("Should reject an unknown interaction type")
  void shouldRejectUnknownType() {
    InteractionLogResult result = interactionLogger.log(session.getId(), request("quiz", null));

    assertThat(result.logged()).isFalse();
    assertThat(result.message()).startsWith("Unknown interaction type: quiz");
  }

  @Test
  @DisplayName("Should refuse to log into an ended session")
  void shouldRejectEndedSession() {
    // Given
    session.setActive(false);

    // When
    InteractionLogResult result = interactionLogger.log(session.getId(), request("hint", null));

    // Then
    assertThat(result.logged()).isFalse();
    verify(learnerInteractionRepository, never()).save(any());
  }

  @Test
  @DisplayName("Should fail for an unknown session")
  void shouldThrow_whenSessionUnknown() {
    UUID unknown = UUID.randomUUID();
    when(tutoringSessionRepository.findById(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> interactionLogger.log(unknown, request("hint", null)))
        .isInstanceOf(TutoringSessionNotFoundException.class);
  }
}
