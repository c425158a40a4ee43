package com.flamingo.ai.studymate.domain.entity;

import com.flamingo.ai.studymate.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A conversation session of an anonymous caller group.
 *
 * <p>Besides free-form metadata, the session owns the navigation state of the document it has
 * open: the pagination cursor lives here so concurrent sessions never share it.
 */
@Entity
@Table(name = "sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  @Builder.Default
  private String title = "New session";

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

  /** Document currently open for navigation, or null. */
  private UUID currentDocumentId;

  /** Page number currently displayed; 0 means the document is open but no page was visited. */
  @Column(nullable = false)
  @Builder.Default
  private Integer currentPage = 0;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  private LocalDateTime lastAccessedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
    lastAccessedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Updates the last accessed timestamp. */
  public void touch() {
    lastAccessedAt = LocalDateTime.now();
  }

  /** Opens a document and resets the cursor. */
  public void openDocument(UUID documentId) {
    this.currentDocumentId = documentId;
    this.currentPage = 0;
  }

  /** Closes the open document and clears the cursor. */
  public void closeDocument() {
    this.currentDocumentId = null;
    this.currentPage = 0;
  }

  /** Applies a metadata patch; null values remove keys. */
  public void patchMetadata(Map<String, Object> patch) {
    if (metadata == null) {
      metadata = new LinkedHashMap<>();
    }
    patch.forEach(
        (key, value) -> {
          if (value == null) {
            metadata.remove(key);
          } else {
            metadata.put(key, value);
          }
        });
  }
}
