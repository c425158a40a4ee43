package com.flamingo.ai.studymate.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymate.api.dto.request.CreateDocumentRequest;
import com.flamingo.ai.studymate.domain.entity.Document;
import com.flamingo.ai.studymate.domain.entity.Session;
import com.flamingo.ai.studymate.domain.enums.DocumentStatus;
import com.flamingo.ai.studymate.domain.repository.DocumentRepository;
import com.flamingo.ai.studymate.exception.DocumentNotFoundException;
import com.flamingo.ai.studymate.exception.SessionNotFoundException;
import com.flamingo.ai.studymate.service.session.SessionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentServiceImplTest {

  @Mock private DocumentRepository documentRepository;

  @Mock private SessionService sessionService;

  @Mock private MeterRegistry meterRegistry;

  @Mock private Counter counter;

  @Mock private DocumentIndexingService documentIndexingService;

  private DocumentServiceImpl documentService;

  private Session testSession;
  private UUID sessionId;

  @BeforeEach
  void setUp() {
    documentService =
        new DocumentServiceImpl(
            documentRepository, sessionService, meterRegistry, documentIndexingService);

    sessionId = UUID.randomUUID();
    testSession = Session.builder().id(sessionId).title("Test Session").build();

    when(meterRegistry.counter(any(String.class), any(String.class), any(String.class)))
        .thenReturn(counter);
    when(documentRepository.save(any(Document.class)))
        .thenAnswer(
            inv -> {
              Document document = inv.getArgument(0);
              document.setId(UUID.randomUUID());
              return document;
            });
  }

  @Test
  void shouldCreateDocument_fromPagesAndScheduleIndexing() {
    // Given
    when(sessionService.getSession(sessionId)).thenReturn(testSession);
    Map<String, String> pages = new LinkedHashMap<>();
    pages.put("2", "Second page");
    pages.put("1", "First page");
    pages.put("cover", "ignored");
    CreateDocumentRequest request =
        CreateDocumentRequest.builder()
            .sessionId(sessionId)
            .title("  Physics  ")
            .pages(pages)
            .sourcePath("books/physics.txt")
            .build();

    // When
    Document result = documentService.createDocument(request);

    // Then
    assertThat(result.getTitle()).isEqualTo("Physics");
    assertThat(result.getSession()).isSameAs(testSession);
    assertThat(result.getPages()).containsOnlyKeys("1", "2");
    assertThat(result.getContent()).isEqualTo("First page\n\nSecond page");
    assertThat(result.getStatus()).isEqualTo(DocumentStatus.PENDING);
    assertThat(result.getMetadata())
        .containsEntry("language", "en")
        .containsEntry("source_path", "books/physics.txt");
    verify(documentIndexingService).indexDocumentAsync(result.getId());
    verify(counter).increment();
  }

  @Test
  void shouldCreateSinglePage_whenOnlyContentGiven() {
    // Given
    CreateDocumentRequest request =
        CreateDocumentRequest.builder().title("Notes").content("Just some text").build();

    // When
    Document result = documentService.createDocument(request);

    // Then
    assertThat(result.getPages()).containsExactly(Map.entry("1", "Just some text"));
    assertThat(result.getSession()).isNull();
  }

  @Test
  void shouldDetectArabic_whenLanguageNotGiven() {
    // Given
    CreateDocumentRequest request =
        CreateDocumentRequest.builder().title("الفيزياء").content("القوة والحركة").build();

    // When
    Document result = documentService.createDocument(request);

    // Then
    assertThat(result.getLanguage()).isEqualTo("ar");
  }

  @Test
  void shouldThrowException_whenNoContent() {
    // Given
    CreateDocumentRequest request =
        CreateDocumentRequest.builder().title("Empty").content("   ").build();

    // When/Then
    assertThatThrownBy(() -> documentService.createDocument(request))
        .isInstanceOf(IllegalArgumentException.class);
    verify(documentRepository, never()).save(any());
    verify(documentIndexingService, never()).indexDocumentAsync(any());
  }

  @Test
  void shouldThrowException_whenSessionUnknown() {
    // Given
    when(sessionService.getSession(sessionId)).thenThrow(new SessionNotFoundException(sessionId));
    CreateDocumentRequest request =
        CreateDocumentRequest.builder().sessionId(sessionId).title("Doc").content("x").build();

    // When/Then
    assertThatThrownBy(() -> documentService.createDocument(request))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void shouldGetDocument_whenDocumentExists() {
    // Given
    UUID documentId = UUID.randomUUID();
    Document document =
        Document.builder().id(documentId).session(testSession).title("Physics").build();
    when(documentRepository.findById(documentId)).thenReturn(Optional.of(document));

    // When
    Document result = documentService.getDocument(documentId);

    // Then
    assertThat(result.getId()).isEqualTo(documentId);
  }

  @Test
  void shouldThrowException_whenDocumentNotFound() {
    // Given
    UUID documentId = UUID.randomUUID();
    when(documentRepository.findById(documentId)).thenReturn(Optional.empty());

    // When/Then
    assertThatThrownBy(() -> documentService.getDocument(documentId))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  void shouldGetDocumentsBySession() {
    // Given
    Document doc1 = Document.builder().id(UUID.randomUUID()).title("One").build();
    Document doc2 = Document.builder().id(UUID.randomUUID()).title("Two").build();
    when(sessionService.getSession(sessionId)).thenReturn(testSession);
    when(documentRepository.findBySessionIdOrderByUploadedAtDesc(sessionId))
        .thenReturn(List.of(doc1, doc2));

    // When
    List<Document> result = documentService.getDocumentsBySession(sessionId);

    // Then
    assertThat(result).hasSize(2);
    verify(sessionService).getSession(sessionId);
  }
}
