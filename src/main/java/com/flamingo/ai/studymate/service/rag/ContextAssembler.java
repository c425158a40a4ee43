package com.flamingo.ai.studymate.service.rag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds a bounded textual context with provenance from passages. Output depends only on the
 * inputs, so the same passages and limits always produce the same text.
 */
@Component
public class ContextAssembler {

  static final String SEPARATOR = "\n\n---\n\n";
  static final String EMPTY_CONTEXT = "No relevant documents found.";

  public String build(List<RetrievedPassage> passages, int maxDocs, int maxChars) {
    if (passages == null || passages.isEmpty()) {
      return EMPTY_CONTEXT;
    }
    List<String> parts = new ArrayList<>();
    for (RetrievedPassage passage : top(passages, maxDocs)) {
      parts.add(formatPart(passage, maxChars));
    }
    return String.join(SEPARATOR, parts);
  }

  /** Same text as {@link #build}, plus per-source metadata. */
  public AssembledContext buildStructured(
      List<RetrievedPassage> passages, int maxDocs, int maxChars) {
    if (passages == null || passages.isEmpty()) {
      return new AssembledContext(EMPTY_CONTEXT, List.of(), 0);
    }
    List<RetrievedPassage> top = top(passages, maxDocs);
    List<String> parts = new ArrayList<>(top.size());
    List<Map<String, Object>> sources = new ArrayList<>(top.size());
    for (RetrievedPassage passage : top) {
      parts.add(formatPart(passage, maxChars));
      Map<String, Object> source = new LinkedHashMap<>();
      source.put("id", passage.chunkId());
      source.put("source", passage.sourceLabel());
      source.put("similarity_score", passage.similarityScore());
      sources.add(source);
    }
    return new AssembledContext(String.join(SEPARATOR, parts), sources, top.size());
  }

  private List<RetrievedPassage> top(List<RetrievedPassage> passages, int maxDocs) {
    List<RetrievedPassage> ordered = new ArrayList<>(passages);
    ordered.sort(Comparator.comparingDouble(RetrievedPassage::similarityScore).reversed());
    return ordered.subList(0, Math.min(Math.max(maxDocs, 0), ordered.size()));
  }

  private String formatPart(RetrievedPassage passage, int maxChars) {
    String content = passage.content() != null ? passage.content() : "";
    if (content.length() > maxChars) {
      content = content.substring(0, maxChars) + "...";
    }
    StringBuilder part = new StringBuilder("Source: ").append(passage.sourceLabel());
    if (passage.similarityScore() > 0) {
      part.append(String.format(Locale.ROOT, " (Similarity: %.3f)", passage.similarityScore()));
    }
    return part.append("\nContent: ").append(content).toString();
  }

  /** Context text with the sources it was built from. */
  public record AssembledContext(
      String context, List<Map<String, Object>> sources, int totalDocuments) {}
}
