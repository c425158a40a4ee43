package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.entity.TutoringSession;
import com.flamingo.ai.studymate.domain.repository.TutoringSessionRepository;
import com.flamingo.ai.studymate.exception.TutoringSessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lifecycle of tutoring sessions: {@code start}, {@code continue}, {@code end} and {@code
 * load_context}.
 *
 * <p>A learner has at most one active session. Starting a session first ends every session still
 * flagged active. Guests get the same actions answered from their in-memory profile; nothing is
 * written for them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TutoringSessionManager {

  public static final String START = "start";
  public static final String CONTINUE = "continue";
  public static final String END = "end";
  public static final String LOAD_CONTEXT = "load_context";

  static final String NEW_SESSION_STARTED = "new_session_started";

  private final TutoringSessionRepository tutoringSessionRepository;
  private final LearnerProfileService learnerProfileService;
  private final MeterRegistry meterRegistry;

  /**
   * Runs a session-management action and returns its user-facing message. The context is updated
   * with the loaded profile and the resulting session id.
   */
  @Transactional
  @Timed(value = "tutoring.session.manage", description = "Time to run a session action")
  public String manage(String action, TutoringContext context) {
    String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);

    if (context.isGuest()) {
      log.debug("Guest session action {} for {}", normalized, context.getLearnerId());
      return guestAction(normalized, context.getProfile());
    }
    if (context.getLearnerId() == null || context.getLearnerId().isBlank()) {
      return "No learner ID provided in state. Cannot manage session.";
    }

    String learnerId = context.getLearnerId();
    switch (normalized) {
      case START -> {
        TutoringSession session = startSession(learnerId);
        LearnerProfile profile = learnerProfileService.getProfile(learnerId);
        context.setProfile(profile);
        context.setTutoringSessionId(session.getId());
        return String.format(
            "Started new tutoring session %s for learner %s. "
                + "Loaded profile: Grade %d, Learning style: %s",
            session.getId(),
            learnerId,
            profile.getGradeLevel(),
            profile.getLearningStyle().getDisplayName());
      }
      case CONTINUE -> {
        context.setProfile(learnerProfileService.getProfile(learnerId));
        Optional<TutoringSession> active = findActiveSession(learnerId);
        if (active.isPresent()) {
          context.setTutoringSessionId(active.get().getId());
          String topic = active.get().getCurrentTopic();
          return "Continuing session %s. Current topic: %s"
              .formatted(active.get().getId(), topic != null ? topic : "none set");
        }
        TutoringSession session = startSession(learnerId);
        context.setTutoringSessionId(session.getId());
        return "No active session found. Started new session " + session.getId();
      }
      case END -> {
        UUID sessionId = context.getTutoringSessionId();
        if (sessionId == null) {
          sessionId = findActiveSession(learnerId).map(TutoringSession::getId).orElse(null);
        }
        if (sessionId == null) {
          return "No active session to end";
        }
        TutoringSession ended = endSession(sessionId);
        context.setTutoringSessionId(null);
        return "Ended session %s. Duration: %s, Performance summary saved."
            .formatted(sessionId, formatDuration(ended.duration()));
      }
      case LOAD_CONTEXT -> {
        LearnerProfile profile = learnerProfileService.getProfile(learnerId);
        context.setProfile(profile);
        findActiveSession(learnerId).ifPresent(s -> context.setTutoringSessionId(s.getId()));
        return "Loaded context for learner %s. Profile: Grade %d, Total sessions: %d"
            .formatted(learnerId, profile.getGradeLevel(), profile.getTotalSessions());
      }
      default -> {
        return "Unknown session management action: "
            + action
            + ". Supported actions: start, continue, end, load_context";
      }
    }
  }

  /**
   * Creates a new active session for a registered learner, ending any session that is still
   * active.
   *
   * @throws com.flamingo.ai.studymate.exception.LearnerNotFoundException if the learner is unknown
   */
  @Transactional
  public TutoringSession startSession(String learnerId) {
    learnerProfileService.getProfile(learnerId);

    List<TutoringSession> stillActive =
        tutoringSessionRepository.findByLearnerIdAndActiveTrue(learnerId);
    for (TutoringSession previous : stillActive) {
      Map<String, Object> summary = new LinkedHashMap<>();
      summary.put("reason", NEW_SESSION_STARTED);
      summary.put("ended_by", NEW_SESSION_STARTED);
      previous.end(summary);
      tutoringSessionRepository.save(previous);
      log.info("Ended previous active session {} of learner {}", previous.getId(), learnerId);
    }

    TutoringSession session =
        tutoringSessionRepository.save(TutoringSession.builder().learnerId(learnerId).build());
    meterRegistry.counter("tutoring.session.started").increment();
    log.info("Started tutoring session {} for learner {}", session.getId(), learnerId);
    return session;
  }

  /**
   * Ends a session and writes its performance summary. Ending an already ended session keeps the
   * first summary.
   */
  @Transactional
  public TutoringSession endSession(UUID tutoringSessionId) {
    TutoringSession session =
        tutoringSessionRepository
            .findById(tutoringSessionId)
            .orElseThrow(() -> new TutoringSessionNotFoundException(tutoringSessionId));

    if (!Boolean.TRUE.equals(session.getActive())) {
      log.debug("Tutoring session {} already ended", tutoringSessionId);
      return session;
    }

    session.end(performanceSummary(session));
    TutoringSession saved = tutoringSessionRepository.save(session);
    meterRegistry.counter("tutoring.session.ended").increment();
    log.info("Ended tutoring session {}", tutoringSessionId);
    return saved;
  }

  @Transactional(readOnly = true)
  public Optional<TutoringSession> findActiveSession(String learnerId) {
    return tutoringSessionRepository.findFirstByLearnerIdAndActiveTrueOrderByStartedAtDesc(
        learnerId);
  }

  @Transactional(readOnly = true)
  public TutoringSession getSession(UUID tutoringSessionId) {
    return tutoringSessionRepository
        .findById(tutoringSessionId)
        .orElseThrow(() -> new TutoringSessionNotFoundException(tutoringSessionId));
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> performanceSummary(TutoringSession session) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("session_ended_at", Instant.now().toString());
    summary.put("ended_by", "session_manager");

    Object progress = session.getSessionState().get(InteractionLogger.LEARNING_PROGRESS);
    if (progress instanceof Map<?, ?> progressMap) {
      summary.putAll((Map<String, Object>) progressMap);
    }

    List<Map<String, Object>> history = session.getInteractionHistory();
    if (history != null && !history.isEmpty()) {
      Set<String> types = new LinkedHashSet<>();
      history.stream()
          .map(entry -> entry.getOrDefault("type", "unknown"))
          .filter(Objects::nonNull)
          .map(Object::toString)
          .forEach(types::add);
      summary.put("total_interactions", history.size());
      summary.put("interaction_types", new ArrayList<>(types));
    }
    return summary;
  }

  private static String guestAction(String action, LearnerProfile profile) {
    return switch (action) {
      case START ->
          String.format(
              "Welcome to your tutoring session! I've created a personalized learning profile"
                  + " based on your query. Grade level: %s, Learning style: %s, Difficulty: %s."
                  + " Let's start learning together!",
              profile != null ? profile.getGradeLevel() : "middle school",
              profile != null ? profile.getLearningStyle().getDisplayName() : "mixed",
              profile != null ? profile.getDifficultyPreference() : "medium");
      case CONTINUE -> "Your guest session is active. What would you like to learn about next?";
      case END ->
          "Thank you for using our tutoring service! Your guest session has ended. Feel free to ask"
              + " me any questions anytime.";
      case LOAD_CONTEXT ->
          "Guest learner profile: Grade %s, Learning style: %s, Language: %s"
              .formatted(
                  profile != null ? profile.getGradeLevel() : "unknown",
                  profile != null ? profile.getLearningStyle().getDisplayName() : "mixed",
                  profile != null ? profile.getPreferredLanguage() : "English");
      default ->
          "Guest session active. I can help you learn regardless of the session state. What would"
              + " you like to explore?";
    };
  }

  static String formatDuration(Duration duration) {
    if (duration == null || duration.getSeconds() <= 0) {
      return "unknown";
    }
    long seconds = duration.getSeconds();
    return "%dmin %ds".formatted(seconds / 60, seconds % 60);
  }
}
