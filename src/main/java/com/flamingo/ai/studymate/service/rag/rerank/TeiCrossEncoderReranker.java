package com.flamingo.ai.studymate.service.rag.rerank;

import com.flamingo.ai.studymate.service.rag.RetrievedPassage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Cross-encoder reranker backed by a TEI container. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeiCrossEncoderReranker implements Reranker {

  private final TeiRerankerClient teiRerankerClient;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.reranker.tei", description = "Time for TEI cross-encoder reranking")
  @CircuitBreaker(name = "tei", fallbackMethod = "rerankFallback")
  public List<RankedPassage> rerank(String query, List<RetrievedPassage> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    log.debug("TEI reranking {} passages", passages.size());

    List<String> texts = passages.stream().map(RetrievedPassage::content).toList();
    List<TeiRerankerClient.RerankResult> results = teiRerankerClient.rerank(query, texts);

    List<TeiRerankerClient.RerankResult> sorted = new ArrayList<>(results);
    sorted.sort(Comparator.comparingDouble(TeiRerankerClient.RerankResult::score).reversed());
    List<RankedPassage> ranked = new ArrayList<>(sorted.size());
    for (TeiRerankerClient.RerankResult result : sorted) {
      ranked.add(
          new RankedPassage(passages.get(result.index()), result.score(), ranked.size() + 1));
    }

    meterRegistry.counter("rag.reranker.tei.invocations").increment();
    return ranked;
  }

  /** Keeps retrieval order and similarity scores when TEI is unavailable. */
  @SuppressWarnings("unused")
  List<RankedPassage> rerankFallback(String query, List<RetrievedPassage> passages, Throwable t) {
    log.warn("TEI reranker unavailable, keeping retrieval order: {}", t.getMessage());
    meterRegistry.counter("rag.reranker.tei.fallback").increment();

    List<RankedPassage> ranked = new ArrayList<>(passages.size());
    for (RetrievedPassage passage : passages) {
      ranked.add(new RankedPassage(passage, passage.similarityScore(), ranked.size() + 1));
    }
    return ranked;
  }
}
