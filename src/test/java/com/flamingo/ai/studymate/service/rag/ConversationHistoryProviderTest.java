package com.flamingo.ai.studymate.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.domain.entity.ConversationTurn;
import com.flamingo.ai.studymate.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.studymate.service.rag.ConversationHistoryProvider.HistoryMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationHistoryProvider Tests")
class ConversationHistoryProviderTest {

  @Mock private ConversationTurnRepository conversationTurnRepository;

  private SimpleMeterRegistry meterRegistry;
  private ConversationHistoryProvider provider;

  private final UUID sessionId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    provider =
        new ConversationHistoryProvider(conversationTurnRepository, new RagConfig(), meterRegistry);
  }

  @Test
  @DisplayName("Should render the placeholder when the session has no turns")
  void shouldRenderPlaceholder_whenNoTurns() {
    // Given
    when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
        .thenReturn(List.of());

    // When / Then
    assertThat(provider.formattedHistory(sessionId))
        .isEqualTo(ConversationHistoryProvider.NO_HISTORY);
  }

  @Test
  @DisplayName("Should give session-less callers no history without touching storage")
  void shouldRenderPlaceholder_whenSessionMissing() {
    assertThat(provider.formattedHistory(null)).isEqualTo(ConversationHistoryProvider.NO_HISTORY);
    verifyNoInteractions(conversationTurnRepository);
  }

  @Test
  @DisplayName("Should render the last six messages oldest first")
  void shouldRenderLastSixMessages_inChronologicalOrder() {
    // Given: repository returns newest first
    when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
        .thenReturn(
            List.of(
                turn("q4", "a4"), turn("q3", "a3"), turn("q2", "a2"), turn("q1", "a1")));

    // When
    String history = provider.formattedHistory(sessionId);

    // Then
    assertThat(history)
        .isEqualTo(
            "Human: q2\nAssistant: a2\nHuman: q3\nAssistant: a3\nHuman: q4\nAssistant: a4");
    ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
    verify(conversationTurnRepository).findRecentTurns(eq(sessionId), page.capture());
    assertThat(page.getValue().getPageSize()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should never read back more than the fifty-message window")
  void shouldCapAtMemoryWindow_whenLimitIsLarger() {
    // Given
    List<ConversationTurn> turns = new ArrayList<>();
    for (int i = 40; i > 0; i--) {
      turns.add(turn("q" + i, "a" + i));
    }
    when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
        .thenReturn(turns);

    // When
    List<HistoryMessage> messages = provider.recent(sessionId, 500);

    // Then
    assertThat(messages).hasSize(50);
    assertThat(messages.get(0)).isEqualTo(new HistoryMessage(true, "q16"));
    assertThat(messages.get(49)).isEqualTo(new HistoryMessage(false, "a40"));
    ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
    verify(conversationTurnRepository).findRecentTurns(eq(sessionId), page.capture());
    assertThat(page.getValue().getPageSize()).isEqualTo(25);
  }

  @Test
  @DisplayName("Should skip the assistant line of an unanswered turn")
  void shouldOmitAssistantLine_whenAnswerMissing() {
    // Given
    when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
        .thenReturn(List.of(turn("open chapter 3", null), turn("hello", "Hi!")));

    // When / Then
    assertThat(provider.formattedHistory(sessionId))
        .isEqualTo("Human: hello\nAssistant: Hi!\nHuman: open chapter 3");
  }

  @Test
  @DisplayName("Should fall back to no history when storage fails")
  void shouldReturnNoHistory_whenRepositoryFails() {
    // Given
    when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
        .thenThrow(new DataAccessResourceFailureException("database is locked"));

    // When / Then
    assertThat(provider.formattedHistory(sessionId))
        .isEqualTo(ConversationHistoryProvider.NO_HISTORY);
    assertThat(meterRegistry.counter("rag.history.errors").count()).isEqualTo(1.0);
  }

  private ConversationTurn turn(String query, String answer) {
    return ConversationTurn.builder()
        .sessionId(sessionId)
        .userQuery(query)
        .answer(answer)
        .handledBy("qa")
        .build();
  }
}
