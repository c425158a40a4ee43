package com.flamingo.ai.studymate.api.rest;

import com.flamingo.ai.studymate.api.dto.request.CreateDocumentRequest;
import com.flamingo.ai.studymate.api.dto.response.DocumentResponse;
import com.flamingo.ai.studymate.domain.entity.Document;
import com.flamingo.ai.studymate.service.document.DocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document management. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Stores a text document; indexing continues in the background. */
  @PostMapping("/documents")
  public ResponseEntity<DocumentResponse> createDocument(
      @Valid @RequestBody CreateDocumentRequest request) {
    Document document = documentService.createDocument(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Gets a document by ID, including its indexing status. */
  @GetMapping("/documents/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    Document document = documentService.getDocument(documentId);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Gets all documents for a session. */
  @GetMapping("/sessions/{sessionId}/documents")
  public ResponseEntity<List<DocumentResponse>> getDocumentsBySession(
      @PathVariable UUID sessionId) {
    List<DocumentResponse> responses =
        documentService.getDocumentsBySession(sessionId).stream()
            .map(DocumentResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }
}
