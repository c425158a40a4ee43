package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.api.dto.request.LogInteractionRequest;
import com.flamingo.ai.studymate.config.TutoringConfig;
import com.flamingo.ai.studymate.domain.entity.LearnerInteraction;
import com.flamingo.ai.studymate.domain.entity.TutoringSession;
import com.flamingo.ai.studymate.domain.enums.InteractionType;
import com.flamingo.ai.studymate.domain.repository.LearnerInteractionRepository;
import com.flamingo.ai.studymate.domain.repository.TutoringSessionRepository;
import com.flamingo.ai.studymate.exception.TutoringSessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends learner interactions to a tutoring session.
 *
 * <p>Besides the interaction row, the session keeps a bounded history of short summaries and a
 * {@code learning_progress} map in its state: per-type counts, the total, the last interaction
 * time and the most recent difficulty ratings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionLogger {

  public static final String LEARNING_PROGRESS = "learning_progress";

  private final LearnerInteractionRepository learnerInteractionRepository;
  private final TutoringSessionRepository tutoringSessionRepository;
  private final TutoringConfig tutoringConfig;
  private final MeterRegistry meterRegistry;

  /** Outcome of a logging request. {@code interactionId} is null when nothing was written. */
  public record InteractionLogResult(boolean logged, UUID interactionId, String message) {

    static InteractionLogResult rejected(String message) {
      return new InteractionLogResult(false, null, message);
    }
  }

  @Transactional
  @Timed(value = "tutoring.interaction.log", description = "Time to log a learner interaction")
  public InteractionLogResult log(UUID tutoringSessionId, LogInteractionRequest request) {
    List<String> missing = new ArrayList<>();
    if (isBlank(request.getInteractionType())) {
      missing.add("interaction_type");
    }
    if (isBlank(request.getQueryText())) {
      missing.add("query_text");
    }
    if (isBlank(request.getResponseText())) {
      missing.add("response_text");
    }
    if (!missing.isEmpty()) {
      return InteractionLogResult.rejected(
          "Missing required fields: " + String.join(", ", missing));
    }

    InteractionType type = InteractionType.fromLabel(request.getInteractionType()).orElse(null);
    if (type == null) {
      return InteractionLogResult.rejected(
          "Unknown interaction type: "
              + request.getInteractionType()
              + ". Supported types: "
              + Arrays.stream(InteractionType.values())
                  .map(InteractionType::getLabel)
                  .collect(Collectors.joining(", ")));
    }

    TutoringSession session =
        tutoringSessionRepository
            .findById(tutoringSessionId)
            .orElseThrow(() -> new TutoringSessionNotFoundException(tutoringSessionId));
    if (!Boolean.TRUE.equals(session.getActive())) {
      return InteractionLogResult.rejected(
          "Tutoring session " + tutoringSessionId + " has ended. Cannot log interaction.");
    }

    Integer rating = validRating(request.getDifficultyRating());
    LearnerInteraction interaction =
        learnerInteractionRepository.save(
            LearnerInteraction.builder()
                .tutoringSessionId(tutoringSessionId)
                .learnerId(session.getLearnerId())
                .interactionType(type)
                .queryText(request.getQueryText())
                .responseText(request.getResponseText())
                .wasHelpful(request.getWasHelpful())
                .difficultyRating(rating)
                .responseTimeSeconds(request.getResponseTimeSeconds())
                .adaptationRequested(request.getAdaptationRequested())
                .learningUnitId(request.getLearningUnitId())
                .metadata(
                    request.getMetadata() != null
                        ? new LinkedHashMap<>(request.getMetadata())
                        : new LinkedHashMap<>())
                .build());

    Map<String, Object> summary = summarize(type, request, rating);
    appendToHistory(session, summary);
    updateProgress(session, type, summary, rating);
    tutoringSessionRepository.save(session);

    meterRegistry.counter("tutoring.interactions", "type", type.getLabel()).increment();
    log.info(
        "Logged {} interaction {} in tutoring session {}",
        type.getLabel(),
        interaction.getId(),
        tutoringSessionId);

    StringBuilder message =
        new StringBuilder(
            "Logged %s interaction %s. ".formatted(type.getLabel(), interaction.getId()));
    if (request.getLearningUnitId() != null) {
      message.append("Learning unit: ").append(request.getLearningUnitId()).append(". ");
    }
    if (rating != null) {
      message.append("Difficulty: ").append(rating).append("/5. ");
    }
    message.append("Session history updated.");
    return new InteractionLogResult(true, interaction.getId(), message.toString());
  }

  private Integer validRating(Integer rating) {
    if (rating == null) {
      return null;
    }
    if (rating < 1 || rating > 5) {
      log.warn("Difficulty rating must be 1-5, got: {}", rating);
      return null;
    }
    return rating;
  }

  private Map<String, Object> summarize(
      InteractionType type, LogInteractionRequest request, Integer rating) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("type", type.getLabel());
    summary.put("query", truncate(request.getQueryText()));
    summary.put("response", truncate(request.getResponseText()));
    summary.put("timestamp", Instant.now().toString());
    if (rating != null) {
      summary.put("difficulty", rating);
    }
    if (request.getResponseTimeSeconds() != null) {
      summary.put("response_time", request.getResponseTimeSeconds());
    }
    if (request.getLearningUnitId() != null) {
      summary.put("learning_unit", request.getLearningUnitId());
    }
    if (request.getWasHelpful() != null) {
      summary.put("helpful", request.getWasHelpful());
    }
    return summary;
  }

  private void appendToHistory(TutoringSession session, Map<String, Object> summary) {
    List<Map<String, Object>> history =
        new ArrayList<>(
            session.getInteractionHistory() != null ? session.getInteractionHistory() : List.of());
    history.add(summary);
    int limit = tutoringConfig.getHistoryLimit();
    if (history.size() > limit) {
      history = new ArrayList<>(history.subList(history.size() - limit, history.size()));
    }
    session.setInteractionHistory(history);
  }

  @SuppressWarnings("unchecked")
  private void updateProgress(
      TutoringSession session, InteractionType type, Map<String, Object> summary, Integer rating) {
    Map<String, Object> state = new LinkedHashMap<>();
    if (session.getSessionState() != null) {
      state.putAll(session.getSessionState());
    }
    Map<String, Object> progress = new LinkedHashMap<>();
    if (state.get(LEARNING_PROGRESS) instanceof Map<?, ?> existing) {
      progress.putAll((Map<String, Object>) existing);
    }

    String countKey = type.getLabel() + "_count";
    progress.put(countKey, intValue(progress.get(countKey)) + 1);
    progress.put("total_interactions", intValue(progress.get("total_interactions")) + 1);
    progress.put("last_interaction", summary.get("timestamp"));

    if (rating != null) {
      List<Object> ratings = new ArrayList<>();
      if (progress.get("difficulty_ratings") instanceof List<?> previous) {
        ratings.addAll(previous);
      }
      ratings.add(rating);
      int limit = tutoringConfig.getDifficultyRatingsLimit();
      if (ratings.size() > limit) {
        ratings = new ArrayList<>(ratings.subList(ratings.size() - limit, ratings.size()));
      }
      progress.put("difficulty_ratings", ratings);
    }

    state.put(LEARNING_PROGRESS, progress);
    session.setSessionState(state);
  }

  private String truncate(String text) {
    int max = tutoringConfig.getSummaryMaxChars();
    return text.length() > max ? text.substring(0, max) + "..." : text;
  }

  private static int intValue(Object value) {
    return value instanceof Number number ? number.intValue() : 0;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
