package com.flamingo.ai.studymate.service.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymate.service.rag.RetrievedPassage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TeiCrossEncoderReranker Tests")
class TeiCrossEncoderRerankerTest {

  @Mock private TeiRerankerClient teiRerankerClient;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private TeiCrossEncoderReranker reranker;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    reranker = new TeiCrossEncoderReranker(teiRerankerClient, meterRegistry);
  }

  @Test
  @DisplayName("Should rerank passages by TEI scores and assign ranks")
  void shouldRerankPassagesByTeiScores() {
    List<RetrievedPassage> passages = new ArrayList<>();
    passages.add(passage("Low relevance content", 0.5));
    passages.add(passage("High relevance content about photosynthesis", 0.4));
    passages.add(passage("Medium relevance content", 0.3));

    when(teiRerankerClient.rerank(anyString(), anyList()))
        .thenReturn(
            List.of(
                new TeiRerankerClient.RerankResult(1, 0.95),
                new TeiRerankerClient.RerankResult(2, 0.60),
                new TeiRerankerClient.RerankResult(0, 0.15)));

    List<Reranker.RankedPassage> results = reranker.rerank("photosynthesis", passages);

    assertThat(results).hasSize(3);
    assertThat(results.get(0).score()).isEqualTo(0.95);
    assertThat(results.get(0).rank()).isEqualTo(1);
    assertThat(results.get(0).passage().content())
        .isEqualTo("High relevance content about photosynthesis");
    assertThat(results.get(1).rank()).isEqualTo(2);
    assertThat(results.get(2).score()).isEqualTo(0.15);
    assertThat(results.get(2).rank()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should sort results by score descending whatever order TEI returns")
  void shouldSortResultsByScoreDescending() {
    List<RetrievedPassage> passages = passages(3);

    when(teiRerankerClient.rerank(anyString(), anyList()))
        .thenReturn(
            List.of(
                new TeiRerankerClient.RerankResult(0, 0.3),
                new TeiRerankerClient.RerankResult(1, 0.9),
                new TeiRerankerClient.RerankResult(2, 0.6)));

    List<Reranker.RankedPassage> results = reranker.rerank("test", passages);

    assertThat(results)
        .extracting(Reranker.RankedPassage::score)
        .containsExactly(0.9, 0.6, 0.3);
  }

  @Test
  @DisplayName("Should not call TEI for an empty passage list")
  void shouldHandleEmptyPassageList() {
    List<Reranker.RankedPassage> results = reranker.rerank("test", List.of());

    assertThat(results).isEmpty();
    verify(teiRerankerClient, never()).rerank(anyString(), anyList());
  }

  @Test
  @DisplayName("Fallback should keep retrieval order with similarity scores")
  void fallbackShouldKeepRetrievalOrder() {
    List<RetrievedPassage> passages =
        List.of(passage("first", 0.1), passage("second", 0.2), passage("third", 0.4));

    List<Reranker.RankedPassage> results =
        reranker.rerankFallback("test", passages, new RuntimeException("TEI unavailable"));

    assertThat(results).hasSize(3);
    assertThat(results.get(0).passage().content()).isEqualTo("first");
    assertThat(results.get(0).score()).isEqualTo(0.9);
    assertThat(results.get(2).score()).isEqualTo(0.6);
    assertThat(results).extracting(Reranker.RankedPassage::rank).containsExactly(1, 2, 3);
  }

  private List<RetrievedPassage> passages(int count) {
    List<RetrievedPassage> passages = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      passages.add(passage("Content " + i, 0.1 * i));
    }
    return passages;
  }

  private RetrievedPassage passage(String content, double distance) {
    return RetrievedPassage.of(
        UUID.randomUUID() + "_0", UUID.randomUUID(), "Biology", 1, "en", content, distance);
  }
}
