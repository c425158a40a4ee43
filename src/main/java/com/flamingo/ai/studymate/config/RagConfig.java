package com.flamingo.ai.studymate.config;

import com.flamingo.ai.studymate.domain.enums.AnswerMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval, gating, context and generation stages. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Relevance relevance = new Relevance();
  private Context context = new Context();
  private Generation generation = new Generation();
  private Reranking reranking = new Reranking();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum characters per chunk. */
    private int size = 1000;

    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 10;
  }

  /**
   * Relevance thresholds. Each call site keeps its own value; they are intentionally not unified.
   */
  @Getter
  @Setter
  public static class Relevance {
    /** Gate used by the qa and summarization handlers. */
    private double qaThreshold = 0.3;

    /** Gate used by the content agent's documents-available check. */
    private double contentAgentThreshold = 0.5;

    /** Minimum reranked score for a passage to be cited in a delegation analysis. */
    private double delegationThreshold = 0.7;

    /** Passages kept after gating, independent of the retrieval topK. */
    private int topN = 5;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxDocs = 5;
    private int maxChars = 5000;
    private int contentAgentMaxChars = 1000;
  }

  @Getter
  @Setter
  public static class Generation {
    /** Messages of history rendered into the prompt. */
    private int historyMessages = 6;

    /** Upper bound on messages read back from a session's persisted turns. */
    private int memoryWindow = 50;

    private AnswerMode answerMode = AnswerMode.TEXT;
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;

    private Tei tei = new Tei();

    /** Configuration for TEI (Text Embeddings Inference) cross-encoder reranker. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int connectTimeoutMs = 5000;
      private int readTimeoutMs = 10000;
    }
  }
}
