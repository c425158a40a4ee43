package com.flamingo.ai.studymate.service.assistant;

import com.flamingo.ai.studymate.domain.enums.IntentType;
import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import com.flamingo.ai.studymate.service.dispatch.ActionRequest;
import com.flamingo.ai.studymate.service.dispatch.ActionResult;
import com.flamingo.ai.studymate.service.dispatch.Dispatcher;
import com.flamingo.ai.studymate.service.dispatch.QueryRequest;
import com.flamingo.ai.studymate.service.dispatch.QueryResult;
import com.flamingo.ai.studymate.service.routing.ActionRoute;
import com.flamingo.ai.studymate.service.routing.ActionRouter;
import com.flamingo.ai.studymate.service.routing.IntentClassifier;
import com.flamingo.ai.studymate.service.routing.IntentResult;
import com.flamingo.ai.studymate.service.routing.QueryRouteResult;
import com.flamingo.ai.studymate.service.routing.QueryRouter;
import com.flamingo.ai.studymate.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class AssistantServiceImpl implements AssistantService {

  static final String EMPTY_QUERY_DETAILS = "Empty query. Routed to general chat.";

  private final SessionService sessionService;
  private final IntentClassifier intentClassifier;
  private final ActionRouter actionRouter;
  private final QueryRouter queryRouter;
  private final Dispatcher dispatcher;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "assistant.handle", description = "Time to handle an utterance end to end")
  public AssistantReply handle(
      UUID sessionId, String utterance, UUID documentId, String learnerId) {
    if (sessionId != null) {
      sessionService.touchSession(sessionId);
    }
    String text = utterance != null ? utterance : "";

    IntentResult intent = intentClassifier.classify(text);
    meterRegistry.counter("assistant.turns", "intent", intent.intentType().getLabel()).increment();

    if (intent.intentType() == IntentType.ACTION) {
      ActionRoute route = actionRouter.route(text);
      ActionResult result =
          dispatcher.dispatchAction(
              new ActionRequest(
                  sessionId, route.actionType(), route.arguments(), text, route.details()));
      log.info(
          "Session {}: action {} -> {}",
          sessionId,
          route.actionType().getLabel(),
          result.status().getLabel());
      return new AssistantReply(
          intent.intentType(),
          intent.confidence(),
          intent.details(),
          route.actionType().getLabel(),
          route.confidence(),
          route.details(),
          result,
          null);
    }

    QueryRouteResult route =
        text.isBlank()
            ? new QueryRouteResult(QueryRoute.UNKNOWN, 0.0, EMPTY_QUERY_DETAILS)
            : queryRouter.route(sessionId, text);
    QueryResult result =
        dispatcher.dispatchQuery(
            new QueryRequest(sessionId, route.route(), text, documentId, learnerId));
    log.info(
        "Session {}: query route {} -> {}",
        sessionId,
        route.route().getLabel(),
        result.status().getLabel());
    return new AssistantReply(
        intent.intentType(),
        intent.confidence(),
        intent.details(),
        route.route().getLabel(),
        route.confidence(),
        route.details(),
        null,
        result);
  }
}
