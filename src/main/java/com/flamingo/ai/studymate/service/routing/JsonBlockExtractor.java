package com.flamingo.ai.studymate.service.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the first well-formed JSON object in model output, tolerating prose or code fences around
 * it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonBlockExtractor {

  /** Confidence assumed when a classifier or router omits its score. */
  public static final double DEFAULT_CONFIDENCE = 0.8;

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  /**
   * Returns the first balanced {@code {...}} block that parses as a JSON object, or empty when the
   * text has none.
   */
  public Optional<Map<String, Object>> extract(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    int start = text.indexOf('{');
    while (start >= 0) {
      int end = findClosingBrace(text, start);
      if (end > start) {
        String candidate = text.substring(start, end + 1);
        try {
          return Optional.of(objectMapper.readValue(candidate, MAP_TYPE));
        } catch (JsonProcessingException e) {
          log.debug("Skipping malformed JSON candidate at offset {}: {}", start, e.getMessage());
        }
      }
      start = text.indexOf('{', start + 1);
    }
    return Optional.empty();
  }

  /** Index of the brace closing the one at {@code start}, ignoring braces inside strings. */
  private int findClosingBrace(String text, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  /** Reads a router confidence, defaulting to {@link #DEFAULT_CONFIDENCE} when missing. */
  public static double confidence(Map<String, Object> json, String key) {
    return confidence(json, key, DEFAULT_CONFIDENCE);
  }

  /** Reads a confidence value: missing yields {@code defaultValue}, non-numeric yields 0.0. */
  public static double confidence(Map<String, Object> json, String key, double defaultValue) {
    Object value = json.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      return 0.0;
    }
  }

  /** Reads a string value, treating blank and JSON null as absent. */
  public static String text(Map<String, Object> json, String key) {
    Object value = json.get(key);
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
  }
}
