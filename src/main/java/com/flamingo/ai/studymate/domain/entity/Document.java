package com.flamingo.ai.studymate.domain.entity;

import com.flamingo.ai.studymate.domain.converter.JsonMapConverter;
import com.flamingo.ai.studymate.domain.converter.PageMapConverter;
import com.flamingo.ai.studymate.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A text document, optionally owned by a session, paginated into a page-number to text map. */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "session_id")
  private Session session;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  /** Keys are page numbers as strings ("1", "2", ...). */
  @Convert(converter = PageMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, String> pages = new LinkedHashMap<>();

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

  private String language;

  private String sourcePath;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  private Integer chunkCount;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  private LocalDateTime indexedAt;

  @PrePersist
  protected void onCreate() {
    uploadedAt = LocalDateTime.now();
  }

  /** Highest numeric page key, if the document has any parsable page. */
  public OptionalInt maxPageNumber() {
    return pages.keySet().stream()
        .filter(key -> key.chars().allMatch(Character::isDigit) && !key.isEmpty())
        .mapToInt(Integer::parseInt)
        .max();
  }

  /** Text of a page, or null when the page does not exist. */
  public String pageText(int pageNumber) {
    return pages.get(String.valueOf(pageNumber));
  }

  /** Marks the document's chunks as embedded and searchable. */
  public void markIndexed(int chunkCount) {
    this.status = DocumentStatus.INDEXED;
    this.chunkCount = chunkCount;
    this.indexedAt = LocalDateTime.now();
  }

  /** Marks indexing as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.processingError = errorMessage;
    this.indexedAt = LocalDateTime.now();
  }
}
