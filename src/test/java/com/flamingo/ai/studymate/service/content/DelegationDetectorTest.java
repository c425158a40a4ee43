package com.flamingo.ai.studymate.service.content;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.studymate.service.content.DelegationDetector.Adaptation;
import com.flamingo.ai.studymate.service.content.DelegationDetector.DelegationSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DelegationDetector Tests")
class DelegationDetectorTest {

  private final DelegationDetector detector = new DelegationDetector();

  @ParameterizedTest(name = "\"{0}\" -> {1}")
  @CsvSource({
    "Can you simplify this chapter?, SIMPLIFY",
    "Give me an example of osmosis, ADD_EXAMPLES",
    "Explain it in a visual way, CHANGE_STYLE",
    "Make the questions harder, INCREASE_DIFFICULTY",
    "Quiz me on the French revolution, TUTORING"
  })
  @DisplayName("Should map cue words to adaptations")
  void shouldDetectAdaptation(String query, Adaptation expected) {
    assertThat(detector.detect(query)).map(DelegationSignal::adaptation).contains(expected);
  }

  @Test
  @DisplayName("Adaptation cues should win over general tutoring cues")
  void shouldPreferEarlierCue() {
    DelegationSignal signal = detector.detect("Teach me with a simpler example").orElseThrow();

    assertThat(signal.adaptation()).isEqualTo(Adaptation.SIMPLIFY);
    assertThat(signal.keyword()).isEqualTo("simple");
  }

  @Test
  @DisplayName("Plain questions should not be delegated")
  void shouldNotDetect_whenNoCue() {
    assertThat(detector.detect("Summarize chapter three")).isEmpty();
    assertThat(detector.detect("  ")).isEmpty();
    assertThat(detector.detect(null)).isEmpty();
  }
}
