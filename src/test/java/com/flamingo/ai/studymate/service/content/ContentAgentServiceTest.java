package com.flamingo.ai.studymate.service.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymate.agent.ContentAssistantAgent;
import com.flamingo.ai.studymate.api.dto.request.TutorRequest;
import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.service.content.DelegationDetector.Adaptation;
import com.flamingo.ai.studymate.service.rag.ContextAssembler;
import com.flamingo.ai.studymate.service.rag.RelevanceGate;
import com.flamingo.ai.studymate.service.rag.RetrievedPassage;
import com.flamingo.ai.studymate.service.rag.Retriever;
import com.flamingo.ai.studymate.service.rag.rerank.Reranker;
import com.flamingo.ai.studymate.service.rag.rerank.Reranker.RankedPassage;
import com.flamingo.ai.studymate.service.tutoring.TutorAgentService;
import com.flamingo.ai.studymate.service.tutoring.TutorResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ContentAgentService Tests")
class ContentAgentServiceTest {

  @Mock private ContentAssistantAgent contentAssistantAgent;
  @Mock private Retriever retriever;
  @Mock private Reranker reranker;
  @Mock private TutorAgentService tutorAgentService;

  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;
  private ContentAgentService service;

  private final UUID sessionId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    service =
        new ContentAgentService(
            contentAssistantAgent,
            retriever,
            new RelevanceGate(),
            new ContextAssembler(),
            reranker,
            new DelegationDetector(),
            tutorAgentService,
            ragConfig,
            meterRegistry);
    when(reranker.rerank(anyString(), anyList())).thenReturn(List.of());
  }

  @Test
  @DisplayName("Should answer an empty query without calling anything")
  void shouldHandleEmptyQuery() {
    ContentAgentResult result = service.handle(request("   "));

    assertThat(result.response()).isEqualTo(ContentAgentService.EMPTY_QUERY);
    assertThat(result.delegated()).isFalse();
    verifyNoInteractions(contentAssistantAgent, retriever, tutorAgentService);
  }

  @Nested
  @DisplayName("Document relevance")
  class DocumentRelevance {

    @Test
    @DisplayName("Relevant passages should be passed to the agent as excerpts")
    void shouldPassExcerpts_whenRelevant() {
      // Given
      when(retriever.retrieve(eq(sessionId), any(), anyString(), anyInt()))
          .thenReturn(List.of(passage("Cells divide by mitosis.", 0.2)));
      when(contentAssistantAgent.respond(anyString(), anyString())).thenReturn("Mitosis is...");

      // When
      ContentAgentResult result = service.handle(request("What is mitosis?"));

      // Then
      ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
      verify(contentAssistantAgent).respond(anyString(), context.capture());
      assertThat(context.getValue()).contains("Content: Cells divide by mitosis.");
      assertThat(result.documentsAvailable()).isTrue();
      assertThat(result.response()).isEqualTo("Mitosis is...");
      assertThat(result.language()).isEqualTo(ContentAgentService.ENGLISH);
    }

    @Test
    @DisplayName("Passages below the content threshold should be dropped")
    void shouldAnswerWithoutExcerpts_whenIrrelevant() {
      // Given
      when(retriever.retrieve(eq(sessionId), any(), anyString(), anyInt()))
          .thenReturn(List.of(passage("Unrelated text", 0.6)));
      when(contentAssistantAgent.respond(anyString(), anyString())).thenReturn("General answer");

      // When
      ContentAgentResult result = service.handle(request("What is mitosis?"));

      // Then
      verify(contentAssistantAgent).respond(anyString(), eq(ContentAgentService.NO_EXCERPTS));
      assertThat(result.documentsAvailable()).isFalse();
      assertThat(result.analysis()).isNull();
    }

    @Test
    @DisplayName("A failing relevance check should still count documents as available")
    void shouldTreatRelevanceErrorAsAvailable() {
      // Given
      when(retriever.retrieve(any(), any(), anyString(), anyInt()))
          .thenThrow(new IllegalStateException("index down"));
      when(contentAssistantAgent.respond(anyString(), anyString())).thenReturn("Answer");

      // When
      ContentAgentResult result = service.handle(request("What is mitosis?"));

      // Then
      assertThat(result.documentsAvailable()).isTrue();
      verify(contentAssistantAgent).respond(anyString(), eq(ContentAgentService.NO_EXCERPTS));
      assertThat(meterRegistry.counter("content.agent.relevance_errors").count()).isEqualTo(1.0);
    }
  }

  @Test
  @DisplayName("Arabic queries should get an Arabic instruction and Arabic fallback")
  void shouldFallBackInArabic_whenAgentFails() {
    // Given
    when(retriever.retrieve(any(), any(), anyString(), anyInt())).thenReturn(List.of());
    when(contentAssistantAgent.respond(anyString(), anyString()))
        .thenThrow(new RuntimeException("model unavailable"));

    // When
    ContentAgentResult result = service.handle(request("ما هي الخلية؟"));

    // Then
    ArgumentCaptor<String> instruction = ArgumentCaptor.forClass(String.class);
    verify(contentAssistantAgent).respond(instruction.capture(), anyString());
    assertThat(instruction.getValue()).startsWith("Please respond in Arabic.");
    assertThat(result.language()).isEqualTo(ContentAgentService.ARABIC);
    assertThat(result.response()).isEqualTo(ContentAgentService.FALLBACK_ARABIC);
    assertThat(meterRegistry.counter("content.agent.fallbacks").count()).isEqualTo(1.0);
  }

  @Nested
  @DisplayName("Delegation")
  class Delegation {

    @BeforeEach
    void setUpRetrieval() {
      when(retriever.retrieve(any(), any(), anyString(), anyInt())).thenReturn(List.of());
      when(contentAssistantAgent.respond(anyString(), anyString())).thenReturn("Content answer");
    }

    @Test
    @DisplayName("Should forward the content answer to the tutor and mark the reply adapted")
    void shouldDelegateToTutor() {
      // Given
      when(tutorAgentService.tutor(any(TutorRequest.class)))
          .thenReturn(new TutorResponse("Simpler answer", "learner-1", false, "s-1", Map.of()));

      // When
      ContentAgentResult result =
          service.handle(
              new ContentAgentRequest(
                  sessionId, null, "Please simplify photosynthesis", "learner-1", "before"));

      // Then
      ArgumentCaptor<TutorRequest> captor = ArgumentCaptor.forClass(TutorRequest.class);
      verify(tutorAgentService).tutor(captor.capture());
      assertThat(captor.getValue().getContentAnswer()).isEqualTo("Content answer");
      assertThat(captor.getValue().getLearnerId()).isEqualTo("learner-1");
      assertThat(captor.getValue().getPreviousQuery()).isEqualTo("before");
      assertThat(result.delegated()).isTrue();
      assertThat(result.adaptation()).isEqualTo(Adaptation.SIMPLIFY);
      assertThat(result.response())
          .isEqualTo("Simpler answer" + ContentAgentService.ADAPTED_SUFFIX);
      assertThat(
              meterRegistry
                  .counter("content.agent.delegations", "adaptation", "simplify")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A failed tutor reply should keep the content answer")
    void shouldKeepContentAnswer_whenTutorFails() {
      // Given
      when(tutorAgentService.tutor(any(TutorRequest.class)))
          .thenReturn(new TutorResponse(TutorAgentService.FAILURE, null, true, null, Map.of()));

      // When
      ContentAgentResult result = service.handle(request("Give me an example of inertia"));

      // Then
      assertThat(result.delegated()).isTrue();
      assertThat(result.response()).isEqualTo("Content answer");
    }

    @Test
    @DisplayName("Requests without a cue should not reach the tutor")
    void shouldNotDelegate_withoutCue() {
      ContentAgentResult result = service.handle(request("Summarize chapter three"));

      assertThat(result.delegated()).isFalse();
      verify(tutorAgentService, never()).tutor(any());
    }
  }

  @Test
  @DisplayName("Reranked analysis should cite passages above the delegation threshold")
  void shouldBuildRelevanceAnalysis() {
    // Given
    RetrievedPassage strong = passage("Strong passage", 0.1);
    RetrievedPassage weak = passage("Weak passage", 0.3);
    when(retriever.retrieve(any(), any(), anyString(), anyInt()))
        .thenReturn(List.of(strong, weak));
    when(contentAssistantAgent.respond(anyString(), anyString())).thenReturn("Answer");
    when(reranker.rerank(anyString(), anyList()))
        .thenReturn(List.of(new RankedPassage(strong, 0.9, 1), new RankedPassage(weak, 0.4, 2)));

    // When
    ContentAgentResult result = service.handle(request("What is mitosis?"));

    // Then
    assertThat(result.analysis()).isNotNull();
    assertThat(result.analysis().rankedPassages()).hasSize(2);
    assertThat(result.analysis().citedIds()).containsExactly(strong.chunkId());
  }

  private ContentAgentRequest request(String query) {
    return new ContentAgentRequest(sessionId, null, query, null, null);
  }

  private RetrievedPassage passage(String content, double distance) {
    return RetrievedPassage.of(
        UUID.randomUUID() + "_0", UUID.randomUUID(), "Biology", 1, "en", content, distance);
  }
}
