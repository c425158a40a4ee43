package com.flamingo.ai.studymate.service.routing;

import com.flamingo.ai.studymate.agent.ActionRouterAgent;
import com.flamingo.ai.studymate.config.RoutingConfig;
import com.flamingo.ai.studymate.domain.enums.ActionType;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Maps an action utterance to a concrete {@link ActionType} with its arguments. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionRouter {

  static final String CLARIFY = "Action type ambiguous or unavailable. Please clarify.";

  private final ActionRouterAgent agent;
  private final JsonBlockExtractor jsonBlockExtractor;
  private final RoutingConfig routingConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "routing.action", description = "Time to route an action")
  public ActionRoute route(String utterance) {
    String raw;
    try {
      raw = agent.route(utterance);
    } catch (Exception e) {
      log.warn("Action routing call failed: {}", e.getMessage());
      return unknown(ActionArguments.none(), "call_failed");
    }

    Optional<Map<String, Object>> parsed = jsonBlockExtractor.extract(raw);
    if (parsed.isEmpty()) {
      log.warn("Action router returned no JSON: {}", raw);
      return unknown(ActionArguments.none(), "unparseable");
    }

    Map<String, Object> json = parsed.get();
    ActionArguments arguments = readArguments(json);
    Optional<ActionType> actionType =
        ActionType.fromLabel(JsonBlockExtractor.text(json, "action_type"));
    double confidence = JsonBlockExtractor.confidence(json, "action_confidence");

    if (actionType.isEmpty()
        || actionType.get() == ActionType.UNKNOWN
        || confidence < routingConfig.getConfidenceThreshold()) {
      return unknown(arguments, "ambiguous");
    }

    String details = JsonBlockExtractor.text(json, "action_details");
    log.info("Action routed to {} ({})", actionType.get().getLabel(), confidence);
    meterRegistry.counter("routing.action", "type", actionType.get().getLabel()).increment();
    return new ActionRoute(actionType.get(), confidence, details != null ? details : "", arguments);
  }

  /** Reads {@code arguments}, letting top-level note_text and page_num fill the gaps. */
  @SuppressWarnings("unchecked")
  private ActionArguments readArguments(Map<String, Object> json) {
    Map<String, Object> args =
        json.get("arguments") instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();

    String docId = JsonBlockExtractor.text(args, "doc_id");
    String noteText = JsonBlockExtractor.text(args, "note_text");
    if (noteText == null) {
      noteText = JsonBlockExtractor.text(json, "note_text");
    }
    Integer pageNum = LocaleDigits.parseInteger(args.get("page_num"));
    if (pageNum == null) {
      pageNum = LocaleDigits.parseInteger(json.get("page_num"));
    }
    return new ActionArguments(docId, pageNum, noteText);
  }

  private ActionRoute unknown(ActionArguments arguments, String reason) {
    meterRegistry.counter("routing.fallback", "stage", "action", "reason", reason).increment();
    return new ActionRoute(ActionType.UNKNOWN, 0.0, CLARIFY, arguments);
  }
}
