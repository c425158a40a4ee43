package com.flamingo.ai.studymate.service.content;

import com.flamingo.ai.studymate.agent.ContentAssistantAgent;
import com.flamingo.ai.studymate.api.dto.request.TutorRequest;
import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.service.content.DelegationDetector.DelegationSignal;
import com.flamingo.ai.studymate.service.rag.ContextAssembler;
import com.flamingo.ai.studymate.service.rag.RelevanceGate;
import com.flamingo.ai.studymate.service.rag.RelevanceGate.GateResult;
import com.flamingo.ai.studymate.service.rag.RetrievedPassage;
import com.flamingo.ai.studymate.service.rag.Retriever;
import com.flamingo.ai.studymate.service.rag.rerank.Reranker;
import com.flamingo.ai.studymate.service.rag.rerank.Reranker.RankedPassage;
import com.flamingo.ai.studymate.service.tutoring.TutorAgentService;
import com.flamingo.ai.studymate.service.tutoring.TutorResponse;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * General content handler: explanations, learning units and free-form questions, grounded in the
 * session's documents when relevant passages exist.
 *
 * <p>After answering, requests that ask for adaptation or tutoring are delegated to the tutoring
 * layer together with the content answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentAgentService {

  static final String EMPTY_QUERY = "I didn't receive any query. How can I help you?";
  static final String NO_EXCERPTS = "No document excerpts available.";
  static final String ADAPTED_SUFFIX =
      "\n\n---\n*Content adapted based on your learning profile and preferences.*";
  static final String ARABIC = "Arabic";
  static final String ENGLISH = "English";

  static final String FALLBACK_ENGLISH =
      "I'm sorry, I encountered an error processing your request. "
          + "I can help with document analysis, creating learning units, or general questions. "
          + "How can I assist you?";
  static final String FALLBACK_ARABIC =
      "عذراً، واجهت خطأ في معالجة استفسارك. "
          + "يمكنني مساعدتك في تحليل المستندات، إنشاء وحدات تعليمية، "
          + "أو الإجابة على الأسئلة العامة. "
          + "كيف يمكنني مساعدتك؟";

  private static final Pattern ARABIC_SCRIPT = Pattern.compile("\\p{InArabic}");

  private final ContentAssistantAgent contentAssistantAgent;
  private final Retriever retriever;
  private final RelevanceGate relevanceGate;
  private final ContextAssembler contextAssembler;
  private final Reranker reranker;
  private final DelegationDetector delegationDetector;
  private final TutorAgentService tutorAgentService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Passages that passed the content-agent gate; an empty list means none are usable. */
  record DocumentCheck(boolean available, List<RetrievedPassage> passages) {}

  @Timed(value = "content.agent", description = "Time to handle a content request")
  public ContentAgentResult handle(ContentAgentRequest request) {
    String query = request.query() == null ? "" : request.query().strip();
    if (query.isEmpty()) {
      return ContentAgentResult.direct(EMPTY_QUERY, ENGLISH, false);
    }

    String language = detectLanguage(query);
    DocumentCheck documents = checkDocuments(request, query);

    String answer;
    try {
      String instruction =
          (ARABIC.equals(language) ? "Please respond in Arabic." : "Please respond in English.")
              + "\n\nUser query: "
              + query;
      String context =
          documents.passages().isEmpty()
              ? NO_EXCERPTS
              : contextAssembler.build(
                  documents.passages(),
                  ragConfig.getContext().getMaxDocs(),
                  ragConfig.getContext().getContentAgentMaxChars());
      answer = contentAssistantAgent.respond(instruction, context);
    } catch (Exception e) {
      log.error("Content agent failed: {}", e.getMessage(), e);
      meterRegistry.counter("content.agent.fallbacks").increment();
      return ContentAgentResult.direct(
          ARABIC.equals(language) ? FALLBACK_ARABIC : FALLBACK_ENGLISH,
          language,
          documents.available());
    }

    RelevanceAnalysis analysis = analyze(query, documents.passages());

    Optional<DelegationSignal> signal = delegationDetector.detect(query);
    if (signal.isEmpty()) {
      return new ContentAgentResult(
          answer, language, documents.available(), false, null, analysis, null);
    }

    log.info(
        "Delegating content request to tutor ({} via '{}')",
        signal.get().adaptation().getLabel(),
        signal.get().keyword());
    meterRegistry
        .counter("content.agent.delegations", "adaptation", signal.get().adaptation().getLabel())
        .increment();

    TutorResponse tutor =
        tutorAgentService.tutor(
            TutorRequest.builder()
                .query(query)
                .learnerId(request.learnerId())
                .contentAnswer(answer)
                .previousQuery(request.previousQuery())
                .build());
    String response =
        TutorAgentService.FAILURE.equals(tutor.response())
            ? answer
            : tutor.response() + ADAPTED_SUFFIX;
    return new ContentAgentResult(
        response,
        language,
        documents.available(),
        true,
        signal.get().adaptation(),
        analysis,
        tutor);
  }

  static String detectLanguage(String query) {
    return ARABIC_SCRIPT.matcher(query).find() ? ARABIC : ENGLISH;
  }

  /**
   * Retrieval plus the content-agent relevance gate. A failing check counts as available so the
   * agent still answers, just without excerpts.
   */
  private DocumentCheck checkDocuments(ContentAgentRequest request, String query) {
    try {
      List<RetrievedPassage> passages =
          retriever.retrieve(
              request.sessionId(),
              request.documentId(),
              query,
              ragConfig.getRetrieval().getTopK());
      GateResult gate =
          relevanceGate.check(
              passages,
              ragConfig.getRelevance().getContentAgentThreshold(),
              ragConfig.getRelevance().getTopN());
      log.debug(
          "Content agent relevance: best {} relevant {}", gate.maxScore(), gate.relevant());
      return gate.relevant()
          ? new DocumentCheck(true, gate.selected())
          : new DocumentCheck(false, List.of());
    } catch (Exception e) {
      log.warn("Relevance check failed, answering without excerpts: {}", e.getMessage());
      meterRegistry.counter("content.agent.relevance_errors").increment();
      return new DocumentCheck(true, List.of());
    }
  }

  private RelevanceAnalysis analyze(String query, List<RetrievedPassage> passages) {
    if (!ragConfig.getReranking().isEnabled() || passages.isEmpty()) {
      return null;
    }
    List<RankedPassage> ranked = reranker.rerank(query, passages);
    double threshold = ragConfig.getRelevance().getDelegationThreshold();
    return new RelevanceAnalysis(
        query,
        ranked.stream()
            .map(r -> new RelevanceAnalysis.RankedEntry(r.passage().chunkId(), r.score(), r.rank()))
            .toList(),
        ranked.stream()
            .filter(r -> r.score() >= threshold)
            .map(r -> r.passage().chunkId())
            .toList());
  }
}
