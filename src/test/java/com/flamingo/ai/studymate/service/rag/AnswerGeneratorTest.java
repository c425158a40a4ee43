package com.flamingo.ai.studymate.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.config.RagConfig;
import com.flamingo.ai.studymate.domain.entity.ConversationTurn;
import com.flamingo.ai.studymate.domain.enums.AnswerMode;
import com.flamingo.ai.studymate.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.studymate.service.routing.JsonBlockExtractor;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
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
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AnswerGenerator Tests")
class AnswerGeneratorTest {

  private static final String CONTEXT = "[Source: Biology]\nPlants convert light into sugar.";

  @Mock private ChatModel textChatModel;
  @Mock private ChatModel jsonChatModel;
  @Mock private ConversationTurnRepository conversationTurnRepository;
  @Captor private ArgumentCaptor<List<ChatMessage>> messagesCaptor;

  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;

  private final UUID sessionId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
        .thenReturn(List.of());
  }

  @Nested
  @DisplayName("Text mode")
  class TextMode {

    @Test
    @DisplayName("Should answer with the model text and embed context and history")
    void shouldReturnModelText_withContextAndHistoryInPrompt() {
      // Given
      when(conversationTurnRepository.findRecentTurns(eq(sessionId), any(Pageable.class)))
          .thenReturn(List.of(turn("What is a leaf?", "An organ of a plant.")));
      when(textChatModel.chat(anyList())).thenReturn(reply("Photosynthesis makes sugar."));
      AnswerGenerator generator = generator(AnswerMode.TEXT);

      // When
      String answer =
          generator.generate(sessionId, "What is photosynthesis?", CONTEXT, GenerationTask.ANSWER);

      // Then
      assertThat(answer).isEqualTo("Photosynthesis makes sugar.");
      verify(textChatModel).chat(messagesCaptor.capture());
      String system = ((SystemMessage) messagesCaptor.getValue().get(0)).text();
      assertThat(system)
          .contains(GenerationTask.ANSWER.getInstruction())
          .contains(CONTEXT)
          .contains("Human: What is a leaf?\nAssistant: An organ of a plant.");
      verify(jsonChatModel, never()).chat(anyList());
    }

    @Test
    @DisplayName("Should render the placeholder history for a new session")
    void shouldUsePlaceholderHistory_whenSessionHasNoTurns() {
      // Given
      when(textChatModel.chat(anyList())).thenReturn(reply("ok"));

      // When
      generator(AnswerMode.TEXT)
          .generateText(sessionId, "Summarize", CONTEXT, GenerationTask.SUMMARY);

      // Then
      verify(textChatModel).chat(messagesCaptor.capture());
      assertThat(((SystemMessage) messagesCaptor.getValue().get(0)).text())
          .endsWith("Conversation history:\n" + ConversationHistoryProvider.NO_HISTORY);
    }

    @Test
    @DisplayName("Should return an apology carrying the error instead of throwing")
    void shouldReturnApology_whenModelFails() {
      // Given
      when(textChatModel.chat(anyList())).thenThrow(new RuntimeException("rate limited"));

      // When
      String answer =
          generator(AnswerMode.TEXT)
              .generate(sessionId, "What is photosynthesis?", CONTEXT, GenerationTask.ANSWER);

      // Then
      assertThat(answer).isEqualTo(AnswerGenerator.ERROR_PREFIX + "rate limited");
      assertThat(meterRegistry.counter("rag.generate.errors", "mode", "text").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("JSON mode")
  class JsonMode {

    @Test
    @DisplayName("Should parse the JSON block and surface its response field")
    void shouldReturnResponseField_whenModelReturnsJson() {
      // Given
      when(jsonChatModel.chat(anyList()))
          .thenReturn(
              reply(
                  "Here you go: {\"response\": \"Light becomes sugar.\","
                      + " \"sources_referenced\": [\"Biology\"], \"confidence\": \"high\"}"));
      AnswerGenerator generator = generator(AnswerMode.JSON);

      // When
      Map<String, Object> json =
          generator.generateJson(sessionId, "Explain", CONTEXT, GenerationTask.ANSWER);
      String answer = generator.generate(sessionId, "Explain", CONTEXT, GenerationTask.ANSWER);

      // Then
      assertThat(json)
          .containsEntry("response", "Light becomes sugar.")
          .containsEntry("confidence", "high")
          .containsEntry("sources_referenced", List.of("Biology"));
      assertThat(answer).isEqualTo("Light becomes sugar.");
      verify(textChatModel, never()).chat(anyList());
    }

    @Test
    @DisplayName("Should return the error shape with low confidence when output is not JSON")
    void shouldReturnErrorShape_whenOutputNotJson() {
      // Given
      when(jsonChatModel.chat(anyList())).thenReturn(reply("Sorry, plain text only"));

      // When
      Map<String, Object> json =
          generator(AnswerMode.JSON)
              .generateJson(sessionId, "Explain", CONTEXT, GenerationTask.ANSWER);

      // Then
      assertThat(json)
          .containsEntry("confidence", "low")
          .containsEntry("sources_referenced", List.of());
      assertThat(json.get("response").toString())
          .startsWith(AnswerGenerator.ERROR_PREFIX)
          .contains("not valid JSON");
      assertThat(meterRegistry.counter("rag.generate.errors", "mode", "json").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Learning unit mode")
  class LearningUnitMode {

    @Test
    @DisplayName("Should map the JSON onto a learning unit")
    void shouldBuildLearningUnit_whenModelReturnsSchema() {
      // Given
      when(jsonChatModel.chat(anyList()))
          .thenReturn(
              reply(
                  "{\"title\": \"Photosynthesis\", \"subtopics\": [\"Light reactions\"],"
                      + " \"detailed_explanation\": \"Plants turn light into sugar.\","
                      + " \"key_points\": [\"Needs light\"], \"difficulty_level\": \"medium\","
                      + " \"learning_objectives\": [\"Describe the process\"],"
                      + " \"keywords\": [\"chlorophyll\"]}"));
      AnswerGenerator generator = generator(AnswerMode.LEARNING_UNIT);

      // When
      LearningUnit unit =
          generator.generateLearningUnit(sessionId, "Teach me", CONTEXT, GenerationTask.ANSWER);
      String answer = generator.generate(sessionId, "Teach me", CONTEXT, GenerationTask.ANSWER);

      // Then
      assertThat(unit.title()).isEqualTo("Photosynthesis");
      assertThat(unit.keyPoints()).containsExactly("Needs light");
      assertThat(unit.difficultyLevel()).isEqualTo("medium");
      assertThat(answer).isEqualTo("Photosynthesis: Plants turn light into sugar.");
    }

    @Test
    @DisplayName("Should return the error unit when required fields are missing")
    void shouldReturnErrorUnit_whenTitleMissing() {
      // Given
      when(jsonChatModel.chat(anyList()))
          .thenReturn(reply("{\"subtopics\": [\"x\"], \"keywords\": []}"));

      // When
      LearningUnit unit =
          generator(AnswerMode.LEARNING_UNIT)
              .generateLearningUnit(sessionId, "Teach me", CONTEXT, GenerationTask.ANSWER);

      // Then
      assertThat(unit.title()).isEqualTo("Error in Processing");
      assertThat(unit.difficultyLevel()).isEqualTo("easy");
      assertThat(unit.detailedExplanation()).startsWith(AnswerGenerator.ERROR_PREFIX);
      assertThat(unit.keyPoints()).containsExactly(unit.detailedExplanation());
      assertThat(meterRegistry.counter("rag.generate.errors", "mode", "learning_unit").count())
          .isEqualTo(1.0);
    }
  }

  @Test
  @DisplayName("Should take its mode from configuration at construction")
  void shouldUseConfiguredMode() {
    assertThat(generator(AnswerMode.TEXT).getMode()).isEqualTo(AnswerMode.TEXT);
    assertThat(generator(AnswerMode.LEARNING_UNIT).getMode()).isEqualTo(AnswerMode.LEARNING_UNIT);
  }

  private AnswerGenerator generator(AnswerMode mode) {
    ragConfig.getGeneration().setAnswerMode(mode);
    ObjectMapper objectMapper = new ObjectMapper();
    return new AnswerGenerator(
        textChatModel,
        jsonChatModel,
        new ConversationHistoryProvider(conversationTurnRepository, ragConfig, meterRegistry),
        new JsonBlockExtractor(objectMapper),
        objectMapper,
        ragConfig,
        meterRegistry);
  }

  private ChatResponse reply(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  private ConversationTurn turn(String query, String answer) {
    return ConversationTurn.builder()
        .sessionId(sessionId)
        .userQuery(query)
        .answer(answer)
        .handledBy("qa")
        .build();
  }
}
