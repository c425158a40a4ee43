package com.flamingo.ai.studymate.service.rag;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.domain.enums.AnswerMode;
import com.flamingo.ai.studymate.service.routing.JsonBlockExtractor;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces grounded answers from a query, an assembled context and the session's recent history.
 *
 * <p>Three output modes are offered: free text, loosely typed JSON and {@link LearningUnit}. The
 * mode used by {@link #generate} is fixed at construction from {@code rag.generation.answer-mode}.
 * Every mode returns a well-formed result on failure, carrying the error message instead of
 * throwing.
 */
@Service
@Slf4j
public class AnswerGenerator {

  static final String ERROR_PREFIX =
      "I'm sorry, I encountered an error while processing your question: ";

  private static final String TEMPLATE =
      """
      You are a study assistant that answers strictly from the provided context.

      Task: %s

      Rules:
      - Use only the context below. If it does not contain the answer, say so.
      - Mention the sources you relied on.
      - Reply in the language of the user's request.

      Context:
      %s

      Conversation history:
      %s""";

  private static final String JSON_FORMAT =
      """


      Format your response as JSON with this structure:
      {"response": "your answer here", "sources_referenced": ["source1", "source2"], \
      "confidence": "high/medium/low"}""";

  private static final String LEARNING_UNIT_FORMAT =
      """


      Format your response as a structured learning unit in JSON with exactly these fields:
      {"title": string, "subtopics": [string], "detailed_explanation": string, \
      "key_points": [string], "difficulty_level": "easy" | "medium" | "hard", \
      "learning_objectives": [string], "keywords": [string]}""";

  private final ChatModel textChatModel;
  private final ChatModel jsonChatModel;
  private final ConversationHistoryProvider historyProvider;
  private final JsonBlockExtractor jsonBlockExtractor;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final AnswerMode mode;

  public AnswerGenerator(
      @Qualifier("textChatModel") ChatModel textChatModel,
      ChatModel jsonChatModel,
      ConversationHistoryProvider historyProvider,
      JsonBlockExtractor jsonBlockExtractor,
      ObjectMapper objectMapper,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.textChatModel = textChatModel;
    this.jsonChatModel = jsonChatModel;
    this.historyProvider = historyProvider;
    this.jsonBlockExtractor = jsonBlockExtractor;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.mode = ragConfig.getGeneration().getAnswerMode();
  }

  /** Generates in the configured mode and returns the text shown to the user. */
  public String generate(UUID sessionId, String query, String context, GenerationTask task) {
    return switch (mode) {
      case TEXT -> generateText(sessionId, query, context, task);
      case JSON -> responseText(generateJson(sessionId, query, context, task));
      case LEARNING_UNIT -> generateLearningUnit(sessionId, query, context, task).answerText();
    };
  }

  public AnswerMode getMode() {
    return mode;
  }

  @Timed(value = "rag.generate", description = "Time to generate an answer")
  public String generateText(UUID sessionId, String query, String context, GenerationTask task) {
    try {
      return call(textChatModel, systemPrompt(task, context, sessionId, ""), query);
    } catch (Exception e) {
      return onError(e, "text", ERROR_PREFIX + e.getMessage());
    }
  }

  /** JSON mode: {@code {response, sources_referenced, confidence}}. */
  @Timed(
      value = "rag.generate",
      description = "Time to generate an answer",
      extraTags = {"mode", "json"})
  public Map<String, Object> generateJson(
      UUID sessionId, String query, String context, GenerationTask task) {
    try {
      String raw = call(jsonChatModel, systemPrompt(task, context, sessionId, JSON_FORMAT), query);
      Optional<Map<String, Object>> parsed = jsonBlockExtractor.extract(raw);
      if (parsed.isEmpty()) {
        throw new IllegalStateException("Model output was not valid JSON");
      }
      return parsed.get();
    } catch (Exception e) {
      String message = onError(e, "json", ERROR_PREFIX + e.getMessage());
      Map<String, Object> error = new LinkedHashMap<>();
      error.put("response", message);
      error.put("sources_referenced", List.of());
      error.put("confidence", "low");
      return error;
    }
  }

  @Timed(
      value = "rag.generate",
      description = "Time to generate an answer",
      extraTags = {"mode", "learning_unit"})
  public LearningUnit generateLearningUnit(
      UUID sessionId, String query, String context, GenerationTask task) {
    try {
      String raw =
          call(jsonChatModel, systemPrompt(task, context, sessionId, LEARNING_UNIT_FORMAT), query);
      Map<String, Object> json =
          jsonBlockExtractor
              .extract(raw)
              .orElseThrow(() -> new IllegalStateException("Model output was not valid JSON"));
      LearningUnit unit = objectMapper.convertValue(json, LearningUnit.class);
      if (unit.title() == null || unit.detailedExplanation() == null) {
        throw new IllegalStateException("Learning unit is missing title or detailed_explanation");
      }
      return unit;
    } catch (Exception e) {
      return LearningUnit.error(onError(e, "learning_unit", ERROR_PREFIX + e.getMessage()));
    }
  }

  private static String responseText(Map<String, Object> json) {
    Object response = json.get("response");
    return response != null ? response.toString() : "";
  }

  private String systemPrompt(GenerationTask task, String context, UUID sessionId, String format) {
    String history = historyProvider.formattedHistory(sessionId);
    return String.format(TEMPLATE, task.getInstruction(), context, history) + format;
  }

  private String call(ChatModel model, String system, String query) {
    List<ChatMessage> messages = List.of(SystemMessage.from(system), UserMessage.from(query));
    return model.chat(messages).aiMessage().text();
  }

  private String onError(Exception e, String mode, String message) {
    log.error("Answer generation failed (mode={}): {}", mode, e.getMessage(), e);
    meterRegistry.counter("rag.generate.errors", "mode", mode).increment();
    return message;
  }
}
