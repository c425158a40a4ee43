package com.flamingo.ai.studymate.service.routing;

import com.flamingo.ai.studymate.agent.IntentClassificationAgent;
import com.flamingo.ai.studymate.config.RoutingConfig;
import com.flamingo.ai.studymate.domain.enums.IntentType;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies utterances into actions and queries. Any doubt about the model output degrades to
 * {@link IntentType#QUERY}, which is the general path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentClassifier {

  static final String AMBIGUOUS =
      "Intent was ambiguous. Routed to general chat for user clarification.";
  static final String UNPARSEABLE = "No JSON found or invalid LLM output.";
  static final String EMPTY_INPUT = "Empty input. Routed to general chat.";

  private final IntentClassificationAgent agent;
  private final JsonBlockExtractor jsonBlockExtractor;
  private final RoutingConfig routingConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "routing.intent", description = "Time to classify intent")
  public IntentResult classify(String utterance) {
    if (utterance == null || utterance.isBlank()) {
      return fallback(EMPTY_INPUT, "empty");
    }

    String raw;
    try {
      raw = agent.classify(utterance);
    } catch (Exception e) {
      log.warn("Intent classification call failed: {}", e.getMessage());
      return fallback(UNPARSEABLE, "call_failed");
    }

    Optional<Map<String, Object>> parsed = jsonBlockExtractor.extract(raw);
    if (parsed.isEmpty()) {
      log.warn("Intent classifier returned no JSON: {}", raw);
      return fallback(UNPARSEABLE, "unparseable");
    }

    Map<String, Object> json = parsed.get();
    Optional<IntentType> intentType =
        IntentType.fromLabel(JsonBlockExtractor.text(json, "intent_type"));
    double confidence = JsonBlockExtractor.confidence(json, "intent_confidence");

    if (intentType.isEmpty() || confidence < routingConfig.getConfidenceThreshold()) {
      log.info(
          "Intent ambiguous (type={}, confidence={}), routing to query",
          json.get("intent_type"),
          confidence);
      return fallback(AMBIGUOUS, "ambiguous");
    }

    String details = JsonBlockExtractor.text(json, "intent_details");
    log.debug("Intent classified as {} ({})", intentType.get(), confidence);
    meterRegistry.counter("routing.intent", "type", intentType.get().getLabel()).increment();
    return new IntentResult(intentType.get(), confidence, details != null ? details : "", false);
  }

  private IntentResult fallback(String details, String reason) {
    meterRegistry.counter("routing.fallback", "stage", "intent", "reason", reason).increment();
    return new IntentResult(IntentType.QUERY, 0.0, details, true);
  }
}
