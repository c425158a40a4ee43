package com.flamingo.ai.studymate.service.tutoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies {@code type:data} updates to a registered learner's durable profile.
 *
 * <p>Supported types are {@code performance}, {@code mastered_topic}, {@code struggle} and {@code
 * preferences}. Payloads are either JSON objects or comma-separated {@code key=value} pairs
 * ({@code key:value} for struggles). Performance metrics move by incremental averages weighted
 * by the learner's completed session count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LearnerModelManager {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final LearnerProfileService learnerProfileService;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /** Parses {@code update_type:data} and applies it. */
  @Transactional
  public String update(String learnerId, String typeAndData) {
    int separator = typeAndData == null ? -1 : typeAndData.indexOf(':');
    if (separator < 0) {
      return "Invalid input format. Expected 'update_type:data'";
    }
    return update(
        learnerId,
        typeAndData.substring(0, separator).trim(),
        typeAndData.substring(separator + 1).trim());
  }

  @Transactional
  @Timed(value = "tutoring.learner.update", description = "Time to update a learner model")
  public String update(String learnerId, String updateType, String data) {
    if (learnerId == null || learnerId.isBlank()) {
      return "No learner ID provided in state. Cannot update learner model.";
    }
    if (LearnerProfile.isGuestId(learnerId)) {
      return "Guest profiles are not persisted. Learner model update skipped.";
    }

    String type = updateType == null ? "" : updateType.trim().toLowerCase(Locale.ROOT);
    String result =
        switch (type) {
          case "performance" -> updatePerformance(learnerId, data);
          case "mastered_topic" -> addMasteredTopic(learnerId, data);
          case "struggle" -> addStruggle(learnerId, data);
          case "preferences" -> updatePreferences(learnerId, data);
          default -> null;
        };
    if (result == null) {
      return "Unknown update type: "
          + updateType
          + ". Supported types: performance, mastered_topic, struggle, preferences";
    }

    meterRegistry.counter("tutoring.learner.updates", "type", type).increment();
    log.info("Applied {} update to learner {}", type, learnerId);
    return result;
  }

  private String updatePerformance(String learnerId, String data) {
    PerformanceSample sample = parsePerformance(data);
    LearnerProfile profile = learnerProfileService.getProfile(learnerId);

    int sessions = profile.getTotalSessions() != null ? profile.getTotalSessions() : 0;
    profile.setAccuracyRate(runningAverage(profile.getAccuracyRate(), sample.accuracy(), sessions));
    profile.setAvgResponseTime(
        runningAverage(profile.getAvgResponseTime(), sample.responseTime(), sessions));
    if (sample.sessionCompleted()) {
      profile.setTotalSessions(sessions + 1);
    }
    learnerProfileService.save(profile);

    return String.format(
        Locale.ROOT,
        "Updated performance metrics for learner %s. New accuracy: %.2f, "
            + "Avg response time: %.1fs, Total sessions: %d",
        learnerId,
        profile.getAccuracyRate(),
        profile.getAvgResponseTime(),
        profile.getTotalSessions());
  }

  private String addMasteredTopic(String learnerId, String topic) {
    if (topic == null || topic.isBlank()) {
      return "Failed to add mastered topic: " + topic;
    }
    LearnerProfile profile = learnerProfileService.getProfile(learnerId);
    List<String> mastered = new ArrayList<>(profile.getMasteredTopics());
    if (!mastered.contains(topic)) {
      mastered.add(topic);
    }
    profile.setMasteredTopics(mastered);
    learnerProfileService.save(profile);
    return "Added '" + topic + "' to mastered topics for learner " + learnerId;
  }

  private String addStruggle(String learnerId, String data) {
    Map<String, String> struggle = parseStruggle(data);
    LearnerProfile profile = learnerProfileService.getProfile(learnerId);

    List<Map<String, Object>> struggles = new ArrayList<>(profile.getLearningStruggles());
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("topic", struggle.get("topic"));
    entry.put("type", struggle.get("type"));
    entry.put("timestamp", Instant.now().toString());
    struggles.add(entry);
    profile.setLearningStruggles(struggles);
    learnerProfileService.save(profile);

    return "Logged learning struggle for learner %s: %s (%s)"
        .formatted(learnerId, struggle.get("topic"), struggle.get("type"));
  }

  private String updatePreferences(String learnerId, String data) {
    Map<String, Object> updates = parseKeyValues(data, '=');
    if (updates.isEmpty()) {
      return "Failed to update preferences: " + data;
    }
    LearnerProfile profile = learnerProfileService.getProfile(learnerId);
    Map<String, Object> preferences = new LinkedHashMap<>(profile.getPreferences());

    updates.forEach(
        (key, value) -> {
          String text = String.valueOf(value);
          switch (key) {
            case "learning_style" -> profile.setLearningStyle(LearningStyle.fromName(text));
            case "grade_level", "grade" -> profile.setGradeLevel(parseGrade(text, profile));
            case "difficulty_preference", "difficulty" -> profile.setDifficultyPreference(text);
            case "preferred_language", "language" -> profile.setPreferredLanguage(text);
            case "name" -> profile.setName(text);
            default -> preferences.put(key, value);
          }
        });
    profile.setPreferences(preferences);
    learnerProfileService.save(profile);

    return "Updated preferences for learner "
        + learnerId
        + ": "
        + updates.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
  }

  PerformanceSample parsePerformance(String data) {
    Map<String, Object> values = parseKeyValues(data, '=');
    return new PerformanceSample(
        doubleValue(values.get("accuracy")),
        doubleValue(values.get("response_time")),
        truthy(values.get("completed")) || truthy(values.get("session_completed")));
  }

  Map<String, String> parseStruggle(String data) {
    Map<String, String> struggle = new LinkedHashMap<>();
    struggle.put("topic", "unknown");
    struggle.put("type", "general_difficulty");
    if (data == null || data.isBlank()) {
      return struggle;
    }

    Map<String, Object> values = parseKeyValues(data, ':');
    if (values.get("topic") != null) {
      struggle.put("topic", values.get("topic").toString());
    }
    if (values.get("type") != null) {
      struggle.put("type", values.get("type").toString());
    }
    if ("unknown".equals(struggle.get("topic")) && !data.trim().startsWith("{")) {
      struggle.put("topic", data.trim());
    }
    return struggle;
  }

  /** JSON object or comma-separated pairs; unparsable input yields an empty map. */
  private Map<String, Object> parseKeyValues(String data, char separator) {
    Map<String, Object> values = new LinkedHashMap<>();
    if (data == null || data.isBlank()) {
      return values;
    }
    String trimmed = data.trim();
    if (trimmed.startsWith("{")) {
      try {
        values.putAll(objectMapper.readValue(trimmed, MAP_TYPE));
      } catch (JsonProcessingException e) {
        log.warn("Failed to parse learner model payload {}: {}", trimmed, e.getOriginalMessage());
      }
      return values;
    }
    for (String pair : trimmed.split(",")) {
      int idx = pair.indexOf(separator);
      if (idx > 0) {
        values.put(pair.substring(0, idx).trim(), pair.substring(idx + 1).trim());
      }
    }
    return values;
  }

  private static double runningAverage(Double current, double sample, int count) {
    double base = current != null ? current : 0.0;
    return (base * count + sample) / (count + 1);
  }

  private Integer parseGrade(String text, LearnerProfile profile) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric grade level '{}' for learner {}", text, profile.getId());
      return profile.getGradeLevel();
    }
  }

  private double doubleValue(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value == null) {
      return 0.0;
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric performance value '{}'", value);
      return 0.0;
    }
  }

  private static boolean truthy(Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    if (value == null) {
      return false;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    return text.equals("true") || text.equals("1") || text.equals("yes");
  }

  record PerformanceSample(double accuracy, double responseTime, boolean sessionCompleted) {}
}
