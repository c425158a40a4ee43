package com.flamingo.ai.studymate.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymate.exception.LlmServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed a query as a float list")
  void shouldEmbedQuery() {
    when(embeddingModel.embed("What is photosynthesis?"))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    List<Float> result = embeddingService.embedQuery("What is photosynthesis?");

    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should truncate very long query text")
  void shouldTruncateVeryLongQueryText() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f})));

    embeddingService.embedQuery("a".repeat(6000));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(5000);
  }

  @Test
  @DisplayName("Should embed passages in one batch preserving order")
  void shouldEmbedDocumentsInOrder() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {1.0f}), Embedding.from(new float[] {2.0f}))));

    List<List<Float>> result = embeddingService.embedDocuments(List.of("first", "second"));

    assertThat(result).containsExactly(List.of(1.0f), List.of(2.0f));
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue()).extracting(TextSegment::text).containsExactly("first", "second");
  }

  @Test
  @DisplayName("Should not call the model for an empty batch")
  void shouldSkipEmptyBatch() {
    assertThat(embeddingService.embedDocuments(List.of())).isEmpty();
    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  @DisplayName("Fallback should surface an LlmServiceException")
  void fallbackShouldThrowLlmServiceException() throws Exception {
    Method fallback =
        EmbeddingService.class.getDeclaredMethod(
            "embedQueryFallback", String.class, Throwable.class);
    fallback.setAccessible(true);

    assertThatThrownBy(
            () -> {
              try {
                fallback.invoke(embeddingService, "q", new RuntimeException("timeout"));
              } catch (InvocationTargetException e) {
                throw e.getCause();
              }
            })
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("timeout");
    verify(meterRegistry.counter("embedding.requests.failure", "type", "query")).increment();
  }
}
