package com.flamingo.ai.studymate.service.rag;

import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.domain.entity.ConversationTurn;
import com.flamingo.ai.studymate.domain.repository.ConversationTurnRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads a session's recent conversation from the persisted turns. Each turn contributes a human
 * message and, when answered, an assistant message. Session-less requests get no history.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationHistoryProvider {

  static final String NO_HISTORY = "No previous conversation.";

  private final ConversationTurnRepository conversationTurnRepository;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** The last messages as {@code Human:}/{@code Assistant:} lines. */
  @Transactional(readOnly = true)
  public String formattedHistory(UUID sessionId) {
    List<HistoryMessage> messages =
        recent(sessionId, ragConfig.getGeneration().getHistoryMessages());
    if (messages.isEmpty()) {
      return NO_HISTORY;
    }
    List<String> lines = new ArrayList<>(messages.size());
    for (HistoryMessage message : messages) {
      lines.add((message.human() ? "Human: " : "Assistant: ") + message.content());
    }
    return String.join("\n", lines);
  }

  /** Up to {@code limit} messages in chronological order, never more than the memory window. */
  @Transactional(readOnly = true)
  public List<HistoryMessage> recent(UUID sessionId, int limit) {
    int window = Math.min(limit, ragConfig.getGeneration().getMemoryWindow());
    if (sessionId == null || window <= 0) {
      return List.of();
    }
    List<ConversationTurn> latest;
    try {
      latest =
          conversationTurnRepository.findRecentTurns(
              sessionId, Pageable.ofSize((window + 1) / 2));
    } catch (Exception e) {
      log.warn("Failed to load history for session {}: {}", sessionId, e.getMessage());
      meterRegistry.counter("rag.history.errors").increment();
      return List.of();
    }

    List<HistoryMessage> messages = new ArrayList<>(latest.size() * 2);
    for (int i = latest.size() - 1; i >= 0; i--) {
      ConversationTurn turn = latest.get(i);
      messages.add(new HistoryMessage(true, turn.getUserQuery()));
      if (turn.getAnswer() != null) {
        messages.add(new HistoryMessage(false, turn.getAnswer()));
      }
    }
    int from = Math.max(0, messages.size() - window);
    return List.copyOf(messages.subList(from, messages.size()));
  }

  /** One message of history. */
  public record HistoryMessage(boolean human, String content) {}
}
