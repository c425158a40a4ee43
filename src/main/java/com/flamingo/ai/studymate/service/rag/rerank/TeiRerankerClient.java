package com.flamingo.ai.studymate.service.rag.rerank;

import com.flamingo.ai.studymate.config.RagConfig;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** HTTP client for the Hugging Face TEI (Text Embeddings Inference) {@code /rerank} endpoint. */
@Component
@Slf4j
public class TeiRerankerClient {

  private final RestClient restClient;
  private final boolean rawScores;
  private final boolean truncate;

  public TeiRerankerClient(RagConfig ragConfig) {
    RagConfig.Reranking.Tei tei = ragConfig.getReranking().getTei();
    this.rawScores = tei.isRawScores();
    this.truncate = tei.isTruncate();

    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(tei.getConnectTimeoutMs());
    requestFactory.setReadTimeout(tei.getReadTimeoutMs());
    this.restClient =
        RestClient.builder().baseUrl(tei.getBaseUrl()).requestFactory(requestFactory).build();
    log.info("TEI reranker client initialized: baseUrl={}", tei.getBaseUrl());
  }

  /**
   * Scores texts against a query.
   *
   * @return results with the input index and score, ordered by TEI by descending score
   */
  public List<RerankResult> rerank(String query, List<String> texts) {
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    List<RerankResult> results =
        restClient
            .post()
            .uri("/rerank")
            .contentType(MediaType.APPLICATION_JSON)
            .body(request)
            .retrieve()
            .body(new ParameterizedTypeReference<List<RerankResult>>() {});
    return results != null ? results : List.of();
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  public record RerankResult(int index, double score) {}
}
