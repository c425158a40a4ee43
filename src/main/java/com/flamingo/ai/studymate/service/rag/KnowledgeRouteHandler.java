package com.flamingo.ai.studymate.service.rag;

import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.domain.enums.QueryRoute;
import com.flamingo.ai.studymate.service.rag.ContextAssembler.AssembledContext;
import com.flamingo.ai.studymate.service.rag.RelevanceGate.GateResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs retrieval, gating, context assembly and generation for the qa and summarization routes.
 * The stages run strictly in sequence and none of them retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeRouteHandler {

  public static final String NO_DOCUMENTS_MESSAGE =
      "I don't have any documents to reference. Please upload documents first before asking"
          + " questions about their content.";

  public static final String LOW_RELEVANCE_MESSAGE =
      "I couldn't find relevant information in the uploaded documents to answer your question."
          + " Please try rephrasing your question or check if the documents contain the"
          + " information you're looking for.";

  static final String ERROR_PREFIX = "I encountered an error while processing your question: ";

  private final Retriever retriever;
  private final RelevanceGate relevanceGate;
  private final ContextAssembler contextAssembler;
  private final AnswerGenerator answerGenerator;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Answers a knowledge query.
   *
   * @param sessionId session of the caller; may be null
   * @param documentId active document that scopes retrieval; null scopes to the session
   * @param documentsAvailable whether any document exists for the caller
   */
  @Timed(value = "rag.knowledge_route", description = "Time to answer a knowledge query")
  public KnowledgeAnswer handle(
      UUID sessionId, UUID documentId, boolean documentsAvailable, String query, QueryRoute route) {
    if (!documentsAvailable) {
      meterRegistry.counter("rag.knowledge_route.no_documents").increment();
      return KnowledgeAnswer.terminal(
          KnowledgeAnswer.Outcome.NO_DOCUMENTS, NO_DOCUMENTS_MESSAGE, RetrievalInfo.empty());
    }

    RetrievalInfo info = RetrievalInfo.empty();
    try {
      List<RetrievedPassage> passages =
          retriever.retrieve(sessionId, documentId, query, ragConfig.getRetrieval().getTopK());
      info = RetrievalInfo.of(passages);

      RagConfig.Relevance relevance = ragConfig.getRelevance();
      GateResult gate =
          relevanceGate.check(passages, relevance.getQaThreshold(), relevance.getTopN());
      if (!gate.relevant()) {
        log.info(
            "Relevance gate rejected {} passages (best={}, threshold={})",
            passages.size(),
            gate.maxScore(),
            relevance.getQaThreshold());
        meterRegistry.counter("rag.gate.rejected", "route", route.getLabel()).increment();
        return KnowledgeAnswer.terminal(
            KnowledgeAnswer.Outcome.LOW_RELEVANCE, LOW_RELEVANCE_MESSAGE, info);
      }

      RagConfig.Context limits = ragConfig.getContext();
      AssembledContext context =
          contextAssembler.buildStructured(
              gate.selected(), limits.getMaxDocs(), limits.getMaxChars());
      GenerationTask task =
          route == QueryRoute.SUMMARIZATION ? GenerationTask.SUMMARY : GenerationTask.ANSWER;
      String response = answerGenerator.generate(sessionId, query, context.context(), task);

      return new KnowledgeAnswer(
          KnowledgeAnswer.Outcome.ANSWERED,
          response,
          info,
          context.sources(),
          context.sources().size(),
          context.context().length());
    } catch (Exception e) {
      log.error("Knowledge route {} failed: {}", route.getLabel(), e.getMessage(), e);
      meterRegistry.counter("rag.knowledge_route.errors", "route", route.getLabel()).increment();
      return KnowledgeAnswer.terminal(
          KnowledgeAnswer.Outcome.ERROR, ERROR_PREFIX + e.getMessage(), info);
    }
  }
}
