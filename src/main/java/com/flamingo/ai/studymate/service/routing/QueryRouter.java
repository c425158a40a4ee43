package com.flamingo.ai.studymate.service.routing;

import com.flamingo.ai.studymate.agent.QueryRouterAgent;
import com.flamingo.ai.studymate.config.RoutingConfig;
import com.flamingo.ai.studymate.domain.entity.RouterDecision;
import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import com.flamingo.ai.studymate.domain.repository.RouterDecisionRepository;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps a knowledge query to the handler that answers it and appends the decision to the audit
 * log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRouter {

  static final String AMBIGUOUS = "Query type ambiguous. Routed to general chat.";

  private final QueryRouterAgent agent;
  private final JsonBlockExtractor jsonBlockExtractor;
  private final RouterDecisionRepository routerDecisionRepository;
  private final RoutingConfig routingConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "routing.query", description = "Time to route a query")
  public QueryRouteResult route(UUID sessionId, String query) {
    QueryRouteResult result = decide(query);
    recordDecision(sessionId, query, result);
    return result;
  }

  private QueryRouteResult decide(String query) {
    String raw;
    try {
      raw = agent.route(query);
    } catch (Exception e) {
      log.warn("Query routing call failed: {}", e.getMessage());
      return unknown("call_failed");
    }

    Optional<Map<String, Object>> parsed = jsonBlockExtractor.extract(raw);
    if (parsed.isEmpty()) {
      log.warn("Query router returned no JSON: {}", raw);
      return unknown("unparseable");
    }

    Map<String, Object> json = parsed.get();
    Optional<QueryRoute> route = QueryRoute.fromLabel(JsonBlockExtractor.text(json, "route"));
    double confidence = JsonBlockExtractor.confidence(json, "route_confidence");

    if (route.isEmpty()
        || route.get() == QueryRoute.UNKNOWN
        || confidence < routingConfig.getConfidenceThreshold()) {
      return unknown("ambiguous");
    }

    String details = JsonBlockExtractor.text(json, "route_details");
    log.info("Query routed to {} ({})", route.get().getLabel(), confidence);
    meterRegistry.counter("routing.query", "route", route.get().getLabel()).increment();
    return new QueryRouteResult(route.get(), confidence, details != null ? details : "");
  }

  private QueryRouteResult unknown(String reason) {
    meterRegistry.counter("routing.fallback", "stage", "query", "reason", reason).increment();
    return new QueryRouteResult(QueryRoute.UNKNOWN, 0.0, AMBIGUOUS);
  }

  /** Best-effort audit write; a failure never changes the routing outcome. */
  private void recordDecision(UUID sessionId, String query, QueryRouteResult result) {
    try {
      routerDecisionRepository.save(
          RouterDecision.builder()
              .sessionId(sessionId)
              .query(query)
              .route(result.route())
              .confidence(result.confidence())
              .build());
    } catch (Exception e) {
      log.warn("Failed to record router decision for session {}: {}", sessionId, e.getMessage());
      meterRegistry.counter("persistence.best_effort.failures", "record", "router_decision")
          .increment();
    }
  }
}
