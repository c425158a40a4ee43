package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.agent.TutorAgent;
import com.flamingo.ai.studymate.api.dto.request.LogInteractionRequest;
import com.flamingo.ai.studymate.api.dto.request.TutorRequest;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.InteractionType;
import com.flamingo.ai.studymate.service.tutoring.ExplanationEngine.ExplanationResult;
import com.flamingo.ai.studymate.service.tutoring.PracticeGenerator.PracticeSet;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the adaptive tutoring layer.
 *
 * <p>Requests without a durable learner id are guest interactions: the profile is inferred from
 * the query and a synthetic session id is issued, and nothing is persisted. Registered learners
 * continue (or start) their tutoring session and every turn is logged as an interaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TutorAgentService {

  static final String EMPTY_INPUT = "Please provide an input";
  public static final String FAILURE = "I couldn't process your request.";
  static final String GUEST_SESSION_PREFIX = "guest_session_";

  private final TutorAgent tutorAgent;
  private final GuestProfileInference guestProfileInference;
  private final TutoringSessionManager tutoringSessionManager;
  private final InteractionLogger interactionLogger;
  private final ExplanationEngine explanationEngine;
  private final PracticeGenerator practiceGenerator;
  private final MeterRegistry meterRegistry;

  /** A resolved context together with the guest indicators that produced it. */
  record ResolvedContext(TutoringContext context, Map<String, List<String>> indicators) {}

  @Timed(value = "tutoring.tutor", description = "Time to answer a tutoring request")
  public TutorResponse tutor(TutorRequest request) {
    String query = request.getQuery();
    if (query == null || query.isBlank()) {
      return new TutorResponse(EMPTY_INPUT, request.getLearnerId(), false, null, Map.of());
    }

    ResolvedContext resolved = null;
    try {
      resolved = resolveContext(request.getLearnerId(), query);
      TutoringContext context = resolved.context();

      String profile = LearnerDescriptions.describe(context.getProfile());
      String answer = tutorAgent.tutor(profile, contextLines(request));
      logInteraction(context, InteractionType.QUESTION, query, answer);

      log.info(
          "Tutored {} learner {} in session {}",
          context.isGuest() ? "guest" : "registered",
          context.getLearnerId(),
          context.sessionReference());
      return response(answer, resolved);
    } catch (Exception e) {
      log.error("Tutoring request failed: {}", e.getMessage(), e);
      meterRegistry.counter("tutoring.fallback", "stage", "tutor").increment();
      return resolved != null
          ? response(FAILURE, resolved)
          : new TutorResponse(FAILURE, request.getLearnerId(), false, null, Map.of());
    }
  }

  /** Explains a topic for the learner and logs an explanation interaction. */
  public ExplanationResult explain(String learnerId, String request) {
    ResolvedContext resolved = resolveContext(learnerId, request);
    ExplanationResult result = explanationEngine.explain(request, resolved.context().getProfile());
    if (result.valid()) {
      logInteraction(resolved.context(), InteractionType.EXPLANATION, request, result.formatted());
    }
    return result;
  }

  /** Generates practice for the learner and logs a practice interaction. */
  public PracticeSet practice(String learnerId, String request) {
    ResolvedContext resolved = resolveContext(learnerId, request);
    PracticeSet set = practiceGenerator.generate(request, resolved.context().getProfile());
    if (set.valid()) {
      logInteraction(resolved.context(), InteractionType.PRACTICE, request, set.formatted());
    }
    return set;
  }

  /**
   * Builds the per-request context: an inferred profile for guests, or the stored profile and the
   * active tutoring session for registered learners.
   */
  ResolvedContext resolveContext(String learnerId, String query) {
    if (isGuestRequest(learnerId)) {
      return guestContext(learnerId, query);
    }

    TutoringContext context = TutoringContext.builder().learnerId(learnerId).build();
    tutoringSessionManager.manage(TutoringSessionManager.CONTINUE, context);
    return new ResolvedContext(context, Map.of());
  }

  /**
   * Runs a session-management action ({@code start}, {@code continue}, {@code end}, {@code
   * load_context}). Guests get the guest texts for a profile inferred from {@code query}.
   */
  @Timed(value = "tutoring.session.action", description = "Time to run a session action")
  public TutorResponse manageSession(String action, String learnerId, String query) {
    ResolvedContext resolved =
        isGuestRequest(learnerId)
            ? guestContext(learnerId, query)
            : new ResolvedContext(TutoringContext.builder().learnerId(learnerId).build(), Map.of());
    String message = tutoringSessionManager.manage(action, resolved.context());
    return response(message, resolved);
  }

  private static boolean isGuestRequest(String learnerId) {
    return learnerId == null || learnerId.isBlank() || LearnerProfile.isGuestId(learnerId);
  }

  private ResolvedContext guestContext(String learnerId, String query) {
    long now = System.currentTimeMillis();
    String guestId =
        learnerId != null && !learnerId.isBlank()
            ? learnerId
            : LearnerProfile.GUEST_ID_PREFIX + now;
    GuestProfileInference.InferredProfile inferred =
        guestProfileInference.infer(guestId, query != null ? query : "");
    TutoringContext context =
        TutoringContext.builder()
            .learnerId(guestId)
            .profile(inferred.profile())
            .guestSessionId(GUEST_SESSION_PREFIX + now)
            .build();
    meterRegistry.counter("tutoring.guest.sessions").increment();
    log.debug(
        "Guest context {} inferred with {}", context.getGuestSessionId(), inferred.indicators());
    return new ResolvedContext(context, inferred.indicators());
  }

  private static String contextLines(TutorRequest request) {
    List<String> parts = new ArrayList<>();
    parts.add("User query: " + request.getQuery());
    if (request.getContentAnswer() != null && !request.getContentAnswer().isBlank()) {
      parts.add("CPA Result: " + request.getContentAnswer());
    }
    if (request.getPreviousQuery() != null && !request.getPreviousQuery().isBlank()) {
      parts.add("Previous query: " + request.getPreviousQuery());
    }
    return String.join("\n\n", parts);
  }

  /** Best-effort: a logging failure never changes the reply. Guests are never logged. */
  private void logInteraction(
      TutoringContext context, InteractionType type, String query, String response) {
    if (context.isGuest() || context.getTutoringSessionId() == null) {
      return;
    }
    try {
      InteractionLogger.InteractionLogResult result =
          interactionLogger.log(
              context.getTutoringSessionId(),
              LogInteractionRequest.builder()
                  .interactionType(type.getLabel())
                  .queryText(query)
                  .responseText(response)
                  .build());
      log.debug(result.message());
    } catch (Exception e) {
      log.warn(
          "Failed to log {} interaction for session {}: {}",
          type.getLabel(),
          context.getTutoringSessionId(),
          e.getMessage());
      meterRegistry.counter("persistence.best_effort.failures", "record", "learner_interaction")
          .increment();
    }
  }

  private static TutorResponse response(String answer, ResolvedContext resolved) {
    TutoringContext context = resolved.context();
    return new TutorResponse(
        answer,
        context.getLearnerId(),
        context.isGuest(),
        context.sessionReference(),
        resolved.indicators());
  }
}
