package com.flamingo.ai.studymate.service.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.agent.QueryRouterAgent;
import com.flamingo.ai.studymate.config.RoutingConfig;
import com.flamingo.ai.studymate.domain.entity.RouterDecision;
import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import com.flamingo.ai.studymate.domain.repository.RouterDecisionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryRouter Tests")
class QueryRouterTest {

  @Mock private QueryRouterAgent agent;
  @Mock private RouterDecisionRepository routerDecisionRepository;

  private SimpleMeterRegistry meterRegistry;
  private QueryRouter router;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    router =
        new QueryRouter(
            agent,
            new JsonBlockExtractor(new ObjectMapper()),
            routerDecisionRepository,
            new RoutingConfig(),
            meterRegistry);
  }

  @Test
  @DisplayName("Should route \"test me\" to qa and record the decision")
  void shouldRouteToQa_andRecordDecision() {
    // Given
    UUID sessionId = UUID.randomUUID();
    when(agent.route("test me"))
        .thenReturn("{\"route\": \"qa\", \"route_confidence\": 0.9, \"route_details\": \"quiz\"}");

    // When
    QueryRouteResult result = router.route(sessionId, "test me");

    // Then
    assertThat(result.route()).isEqualTo(QueryRoute.QA);
    assertThat(result.confidence()).isEqualTo(0.9);
    ArgumentCaptor<RouterDecision> captor = ArgumentCaptor.forClass(RouterDecision.class);
    verify(routerDecisionRepository).save(captor.capture());
    assertThat(captor.getValue().getSessionId()).isEqualTo(sessionId);
    assertThat(captor.getValue().getQuery()).isEqualTo("test me");
    assertThat(captor.getValue().getRoute()).isEqualTo(QueryRoute.QA);
  }

  @Test
  @DisplayName("Should map the agents label to the content agent")
  void shouldMapAgentsAlias_toContentAgent() {
    // Given
    when(agent.route(anyString()))
        .thenReturn("{\"route\": \"agents\", \"route_confidence\": 0.8}");

    // When
    QueryRouteResult result = router.route(null, "اشرح الجاذبية");

    // Then
    assertThat(result.route()).isEqualTo(QueryRoute.CONTENT_AGENT);
  }

  @Test
  @DisplayName("Should assume the default confidence when the router omits it")
  void shouldRoute_whenConfidenceMissing() {
    // Given
    when(agent.route(anyString())).thenReturn("{\"route\": \"summarization\"}");

    // When
    QueryRouteResult result = router.route(null, "summarize chapter 1");

    // Then
    assertThat(result.route()).isEqualTo(QueryRoute.SUMMARIZATION);
    assertThat(result.confidence()).isEqualTo(JsonBlockExtractor.DEFAULT_CONFIDENCE);
  }

  @Test
  @DisplayName("Should fall back to unknown below the confidence threshold")
  void shouldFallbackToUnknown_whenConfidenceLow() {
    // Given
    when(agent.route(anyString()))
        .thenReturn("{\"route\": \"summarization\", \"route_confidence\": 0.3}");

    // When
    QueryRouteResult result = router.route(null, "summarize?");

    // Then
    assertThat(result.route()).isEqualTo(QueryRoute.UNKNOWN);
    assertThat(result.details()).isEqualTo(QueryRouter.AMBIGUOUS);
  }

  @Test
  @DisplayName("Should keep the routing outcome when the audit write fails")
  void shouldKeepOutcome_whenAuditWriteFails() {
    // Given
    when(agent.route(anyString()))
        .thenReturn("{\"route\": \"summarization\", \"route_confidence\": 0.95}");
    when(routerDecisionRepository.save(any(RouterDecision.class)))
        .thenThrow(new RuntimeException("database is locked"));

    // When
    QueryRouteResult result = router.route(UUID.randomUUID(), "لخص الفصل");

    // Then
    assertThat(result.route()).isEqualTo(QueryRoute.SUMMARIZATION);
    assertThat(
            meterRegistry
                .counter("persistence.best_effort.failures", "record", "router_decision")
                .count())
        .isEqualTo(1.0);
  }
}
