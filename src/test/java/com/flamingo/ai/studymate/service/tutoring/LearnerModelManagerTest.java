package com.flamingo.ai.studymate.service.tutoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LearnerModelManager Tests")
class LearnerModelManagerTest {

  private static final String LEARNER_ID = "student-42";

  @Mock private LearnerProfileService learnerProfileService;

  private LearnerModelManager manager;
  private LearnerProfile profile;

  @BeforeEach
  void setUp() {
    manager =
        new LearnerModelManager(
            learnerProfileService, new ObjectMapper(), new SimpleMeterRegistry());
    profile =
        LearnerProfile.builder()
            .id(LEARNER_ID)
            .accuracyRate(0.6)
            .avgResponseTime(20.0)
            .totalSessions(3)
            .build();
    when(learnerProfileService.getProfile(LEARNER_ID)).thenReturn(profile);
    when(learnerProfileService.save(any(LearnerProfile.class)))
        .thenAnswer(inv -> inv.getArgument(0));
  }

  @Test
  @DisplayName("Performance updates should move metrics by a running average")
  void shouldApplyRunningAverage() {
    // When
    String message =
        manager.update(LEARNER_ID, "performance:accuracy=1.0,response_time=10,completed=true");

    // Then
    assertThat(profile.getAccuracyRate()).isCloseTo(0.7, within(1e-9));
    assertThat(profile.getAvgResponseTime()).isCloseTo(17.5, within(1e-9));
    assertThat(profile.getTotalSessions()).isEqualTo(4);
    assertThat(message).contains("New accuracy: 0.70");
    verify(learnerProfileService).save(profile);
  }

  @Test
  @DisplayName("Performance updates should accept a JSON payload")
  void shouldAcceptJsonPerformancePayload() {
    manager.update(LEARNER_ID, "performance", "{\"accuracy\": 0.2, \"response_time\": 20}");

    assertThat(profile.getAccuracyRate()).isCloseTo(0.5, within(1e-9));
    assertThat(profile.getTotalSessions()).isEqualTo(3);
  }

  @Test
  @DisplayName("Mastered topics should not be duplicated")
  void shouldNotDuplicateMasteredTopic() {
    manager.update(LEARNER_ID, "mastered_topic:fractions");
    manager.update(LEARNER_ID, "mastered_topic:fractions");

    assertThat(profile.getMasteredTopics()).containsExactly("fractions");
  }

  @Test
  @DisplayName("Struggles should record topic and type")
  void shouldRecordStruggle() {
    String message = manager.update(LEARNER_ID, "struggle", "topic:algebra,type:conceptual");

    assertThat(profile.struggleTopics()).containsExactly("algebra");
    assertThat(profile.getLearningStruggles().get(0)).containsEntry("type", "conceptual");
    assertThat(message).endsWith("algebra (conceptual)");
  }

  @Test
  @DisplayName("A bare struggle payload should become the topic")
  void shouldUseBarePayloadAsStruggleTopic() {
    assertThat(manager.parseStruggle("long division"))
        .containsEntry("topic", "long division")
        .containsEntry("type", "general_difficulty");
  }

  @Test
  @DisplayName("Preferences should update profile fields and keep the rest as preferences")
  void shouldUpdatePreferences() {
    manager.update(LEARNER_ID, "preferences:learning_style=visual,grade=10,pace=slow");

    assertThat(profile.getLearningStyle()).isEqualTo(LearningStyle.VISUAL);
    assertThat(profile.getGradeLevel()).isEqualTo(10);
    assertThat(profile.getPreferences()).containsEntry("pace", "slow");
  }

  @Test
  @DisplayName("Guests and malformed input should not touch storage")
  void shouldSkipGuestsAndMalformedInput() {
    assertThat(manager.update("guest_1700000000000", "mastered_topic:fractions"))
        .startsWith("Guest profiles are not persisted");
    assertThat(manager.update(LEARNER_ID, "no separator"))
        .isEqualTo("Invalid input format. Expected 'update_type:data'");
    assertThat(manager.update(LEARNER_ID, "mood:happy")).startsWith("Unknown update type: mood");
    verifyNoInteractions(learnerProfileService);
  }

  @Test
  @DisplayName("Unparseable preference payloads should be reported")
  void shouldReportEmptyPreferences() {
    assertThat(manager.update(LEARNER_ID, "preferences", "{not json"))
        .startsWith("Failed to update preferences");
    assertThat(profile.getPreferences()).isEmpty();
  }
}
