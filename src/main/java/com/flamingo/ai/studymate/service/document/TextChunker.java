package com.flamingo.ai.studymate.service.document;

import com.flamingo.ai.studymate.config.RagConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Sliding-window chunker over characters.
 *
 * <p>Paragraphs are packed into windows of at most {@code rag.chunking.size} characters, and each
 * new window starts with the last {@code rag.chunking.overlap} characters of the previous one,
 * cut at a word boundary. Paragraphs longer than a window are split on whitespace. Paginated
 * documents are chunked page by page so every chunk keeps its originating page.
 */
@Component
@RequiredArgsConstructor
public class TextChunker {

  private final RagConfig ragConfig;

  public List<TextChunk> chunk(String content, Map<String, String> pages) {
    int size = Math.max(1, ragConfig.getChunking().getSize());
    int overlap = Math.max(0, Math.min(ragConfig.getChunking().getOverlap(), size / 2));

    List<TextChunk> chunks = new ArrayList<>();
    Map<Integer, String> numbered = numericPages(pages);
    if (numbered.isEmpty()) {
      for (String window : slidingWindow(content, size, overlap)) {
        chunks.add(new TextChunk(chunks.size(), null, window));
      }
      return chunks;
    }
    numbered.forEach(
        (page, text) -> {
          for (String window : slidingWindow(text, size, overlap)) {
            chunks.add(new TextChunk(chunks.size(), page, window));
          }
        });
    return chunks;
  }

  static List<String> slidingWindow(String text, int size, int overlap) {
    List<String> windows = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return windows;
    }

    StringBuilder current = new StringBuilder();
    for (String paragraph : text.split("\\n\\s*\\n")) {
      String trimmed = paragraph.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      for (String piece : splitLong(trimmed, size)) {
        int separator = current.length() > 0 ? 2 : 0;
        if (current.length() + separator + piece.length() > size && current.length() > 0) {
          String window = current.toString();
          windows.add(window);
          current = new StringBuilder(overlapTail(window, overlap));
          if (current.length() + 2 + piece.length() > size) {
            current.setLength(0);
          }
        }
        if (current.length() > 0) {
          current.append("\n\n");
        }
        current.append(piece);
      }
    }
    if (current.length() > 0) {
      windows.add(current.toString());
    }
    return windows;
  }

  /** Splits text longer than {@code size} on whitespace, hard-cutting words that never fit. */
  private static List<String> splitLong(String text, int size) {
    List<String> pieces = new ArrayList<>();
    String remaining = text;
    while (remaining.length() > size) {
      int cut = remaining.lastIndexOf(' ', size);
      if (cut <= 0) {
        cut = size;
      }
      pieces.add(remaining.substring(0, cut).strip());
      remaining = remaining.substring(cut).strip();
    }
    if (!remaining.isEmpty()) {
      pieces.add(remaining);
    }
    return pieces;
  }

  private static String overlapTail(String window, int overlap) {
    if (overlap == 0 || window.length() <= overlap) {
      return overlap == 0 ? "" : window;
    }
    String tail = window.substring(window.length() - overlap);
    int firstSpace = tail.indexOf(' ');
    return firstSpace >= 0 ? tail.substring(firstSpace + 1) : tail;
  }

  private static Map<Integer, String> numericPages(Map<String, String> pages) {
    Map<Integer, String> numbered = new TreeMap<>();
    if (pages == null) {
      return numbered;
    }
    pages.forEach(
        (key, text) -> {
          if (key != null && !key.isEmpty() && key.chars().allMatch(Character::isDigit)) {
            numbered.put(Integer.parseInt(key), text);
          }
        });
    return numbered;
  }
}
