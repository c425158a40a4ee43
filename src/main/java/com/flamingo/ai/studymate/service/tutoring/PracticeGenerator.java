package com.flamingo.ai.studymate.service.tutoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymate.agent.PracticeAgent;
import com.flamingo.ai.studymate.config.TutoringConfig;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import com.flamingo.ai.studymate.domain.enums.PracticeDifficulty;
import com.flamingo.ai.studymate.domain.enums.PracticeType;
import com.flamingo.ai.studymate.service.routing.JsonBlockExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates practice sets (problems, quizzes, exercises, assessments, flashcards) at a difficulty
 * chosen for the learner.
 *
 * <p>Difficulty selection is ordered: an explicitly requested level, then the learner's stored
 * preference, then struggles (easy), then a grade baseline adjusted by accuracy, then learning
 * style, then medium.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PracticeGenerator {

  static final String INVALID_REQUEST =
      "Invalid practice request format. Please specify the topic and type of practice needed.";
  static final int MAX_ITEMS = 20;
  static final int MAX_FALLBACK_ITEMS = 3;

  private static final String PRACTICE_WORDS = "(?:practice|problems|quiz|exercises?|assessment)";

  private static final List<Pattern> TOPIC_PATTERNS =
      List.of(
          Pattern.compile(
              PRACTICE_WORDS + "\\s+(?:for|on|about)\\s+(.+?)(?:\\s+using|\\s+with|\\s+\\d+|$)"),
          Pattern.compile("generate\\s+(.+?)\\s+" + PRACTICE_WORDS),
          Pattern.compile("topic:\\s*(.+?)(?:\\s+type:|\\s+difficulty:|\\s+items:|,|$)"),
          Pattern.compile("(.+?)\\s+" + PRACTICE_WORDS));

  private static final Pattern LEADING_VERB =
      Pattern.compile("^(generate|create|make|give me)\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRAILING_PRACTICE =
      Pattern.compile("\\s+" + PRACTICE_WORDS + ".*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern ITEM_COUNT =
      Pattern.compile("(\\d+)\\s+(?:items?|problems?|questions?|exercises?)");

  private static final Map<String, PracticeType> TYPE_KEYWORDS = typeKeywords();

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final PracticeAgent practiceAgent;
  private final JsonBlockExtractor jsonBlockExtractor;
  private final ObjectMapper objectMapper;
  private final TutoringConfig tutoringConfig;
  private final MeterRegistry meterRegistry;

  /** Parsed practice request. A null difficulty means none was asked for. */
  public record PracticeRequest(
      String topic,
      PracticeType type,
      int itemCount,
      PracticeDifficulty requestedDifficulty,
      boolean includeAnswers) {}

  public record PracticeItem(String id, String question, String answer, String explanation) {}

  public record PracticeSet(
      String topic,
      PracticeType type,
      PracticeDifficulty difficulty,
      boolean includeAnswers,
      List<PracticeItem> items,
      boolean fallback,
      String formatted) {

    public boolean valid() {
      return type != null;
    }

    static PracticeSet invalid() {
      return new PracticeSet(null, null, null, false, List.of(), false, INVALID_REQUEST);
    }
  }

  /** Parses the request (natural language or a JSON object) and generates the set. */
  @Timed(value = "tutoring.practice", description = "Time to generate a practice set")
  public PracticeSet generate(String request, LearnerProfile profile) {
    Optional<PracticeRequest> parsed = parseRequest(request);
    if (parsed.isEmpty()) {
      return PracticeSet.invalid();
    }
    return generate(parsed.get(), profile);
  }

  public PracticeSet generate(PracticeRequest request, LearnerProfile profile) {
    PracticeDifficulty difficulty = selectDifficulty(profile, request.requestedDifficulty());

    List<PracticeItem> items = callAgent(request, difficulty, profile);
    boolean fallback = items.isEmpty();
    if (fallback) {
      meterRegistry.counter("tutoring.fallback", "stage", "practice").increment();
      items = fallbackItems(request.topic(), request.itemCount());
    }

    log.info(
        "Generated {} {} {} about '{}'{}",
        items.size(),
        difficulty.getLabel(),
        request.type().getLabel(),
        request.topic(),
        fallback ? " (fallback)" : "");
    meterRegistry.counter("tutoring.practice.sets", "type", request.type().getLabel()).increment();
    return new PracticeSet(
        request.topic(),
        request.type(),
        difficulty,
        request.includeAnswers(),
        items,
        fallback,
        format(request.type(), difficulty, items, request.includeAnswers()));
  }

  Optional<PracticeRequest> parseRequest(String request) {
    if (request == null || request.isBlank()) {
      return Optional.empty();
    }
    String trimmed = request.trim();
    if (trimmed.startsWith("{")) {
      return parseJsonRequest(trimmed);
    }

    String lower = trimmed.toLowerCase(Locale.ROOT);
    String topic = null;
    for (Pattern pattern : TOPIC_PATTERNS) {
      Matcher matcher = pattern.matcher(lower);
      if (matcher.find()) {
        topic = matcher.group(1).trim();
        break;
      }
    }
    if (topic == null) {
      String stripped = LEADING_VERB.matcher(trimmed).replaceFirst("");
      topic = TRAILING_PRACTICE.matcher(stripped).replaceFirst("").trim();
    }
    if (topic.isEmpty()) {
      return Optional.empty();
    }

    PracticeType type = PracticeType.PROBLEMS;
    for (Map.Entry<String, PracticeType> entry : TYPE_KEYWORDS.entrySet()) {
      if (lower.contains(entry.getKey())) {
        type = entry.getValue();
        break;
      }
    }

    int count = tutoringConfig.getDefaultPracticeItems();
    Matcher countMatcher = ITEM_COUNT.matcher(lower);
    if (countMatcher.find()) {
      count = clampCount(Integer.parseInt(countMatcher.group(1)));
    }

    PracticeDifficulty difficulty = null;
    if (containsAny(lower, "easy", "simple", "basic")) {
      difficulty = PracticeDifficulty.EASY;
    } else if (containsAny(lower, "medium", "moderate", "intermediate")) {
      difficulty = PracticeDifficulty.MEDIUM;
    } else if (containsAny(lower, "hard", "difficult", "advanced", "challenging")) {
      difficulty = PracticeDifficulty.HARD;
    }

    boolean includeAnswers = !containsAny(lower, "no answers", "without answers", "hide answers");
    return Optional.of(new PracticeRequest(topic, type, count, difficulty, includeAnswers));
  }

  private Optional<PracticeRequest> parseJsonRequest(String json) {
    Map<String, Object> values;
    try {
      values = objectMapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Invalid practice request JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
    String topic = JsonBlockExtractor.text(values, "topic");
    if (topic == null) {
      return Optional.empty();
    }
    PracticeType type =
        PracticeType.fromLabel(JsonBlockExtractor.text(values, "practice_type"))
            .orElse(PracticeType.PROBLEMS);
    int count =
        values.get("num_items") instanceof Number n
            ? clampCount(n.intValue())
            : tutoringConfig.getDefaultPracticeItems();
    PracticeDifficulty difficulty =
        PracticeDifficulty.fromLabel(JsonBlockExtractor.text(values, "difficulty_level"))
            .orElse(null);
    boolean includeAnswers = !Boolean.FALSE.equals(values.get("include_answers"));
    return Optional.of(new PracticeRequest(topic, type, count, difficulty, includeAnswers));
  }

  static PracticeDifficulty selectDifficulty(
      LearnerProfile profile, PracticeDifficulty requested) {
    if (requested != null) {
      return requested;
    }
    if (profile == null) {
      return PracticeDifficulty.MEDIUM;
    }

    Optional<PracticeDifficulty> stored = storedPreference(profile);
    if (stored.isPresent()) {
      return stored.get();
    }
    if (profile.hasStruggles()) {
      return PracticeDifficulty.EASY;
    }

    Integer grade = profile.getGradeLevel();
    if (grade != null) {
      PracticeDifficulty baseline =
          grade <= 6 ? PracticeDifficulty.EASY : PracticeDifficulty.MEDIUM;
      double accuracy = profile.getAccuracyRate() != null ? profile.getAccuracyRate() : 0.7;
      if (accuracy > 0.75) {
        return baseline.harder();
      }
      if (accuracy < 0.65) {
        return baseline.easier();
      }
      return baseline;
    }

    if (profile.getLearningStyle() == LearningStyle.ANALYTICAL) {
      return PracticeDifficulty.HARD;
    }
    return PracticeDifficulty.MEDIUM;
  }

  /**
   * An explicit practice difficulty in the preferences map, or a non-neutral difficulty
   * preference on the profile.
   */
  private static Optional<PracticeDifficulty> storedPreference(LearnerProfile profile) {
    Map<String, Object> preferences = profile.getPreferences();
    Object explicit = preferences != null ? preferences.get("practice_difficulty") : null;
    if (explicit != null) {
      Optional<PracticeDifficulty> parsed = PracticeDifficulty.fromLabel(explicit.toString());
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    String preference = profile.getDifficultyPreference();
    if (preference == null || "medium".equalsIgnoreCase(preference.trim())) {
      return Optional.empty();
    }
    return PracticeDifficulty.fromLabel(preference);
  }

  private List<PracticeItem> callAgent(
      PracticeRequest request, PracticeDifficulty difficulty, LearnerProfile profile) {
    String raw;
    try {
      raw =
          practiceAgent.generate(
              request.topic(),
              request.type().getLabel(),
              difficulty.getLabel(),
              request.itemCount(),
              request.includeAnswers(),
              LearnerDescriptions.describe(profile));
    } catch (Exception e) {
      log.warn("Practice generation failed for '{}': {}", request.topic(), e.getMessage());
      return List.of();
    }

    Optional<Map<String, Object>> json = jsonBlockExtractor.extract(raw);
    if (json.isEmpty() || !(json.get().get("items") instanceof List<?> rawItems)) {
      log.warn("Practice agent returned no items for '{}'", request.topic());
      return List.of();
    }

    List<PracticeItem> items = new ArrayList<>();
    for (Object rawItem : rawItems) {
      if (!(rawItem instanceof Map<?, ?> map) || map.get("question") == null) {
        continue;
      }
      items.add(
          new PracticeItem(
              "item_" + (items.size() + 1),
              map.get("question").toString(),
              map.get("answer") != null ? map.get("answer").toString() : null,
              map.get("explanation") != null ? map.get("explanation").toString() : null));
      if (items.size() == request.itemCount()) {
        break;
      }
    }
    return items;
  }

  static List<PracticeItem> fallbackItems(String topic, int requested) {
    List<PracticeItem> items = new ArrayList<>();
    for (int i = 1; i <= Math.min(requested, MAX_FALLBACK_ITEMS); i++) {
      items.add(
          new PracticeItem(
              "fallback_" + i,
              "Practice question %d about %s. Please work through this concept step by step."
                  .formatted(i, topic),
              "Please work through this %s problem systematically, applying the key concepts."
                  .formatted(topic),
              String.format(
                  "This question tests your understanding of %s. "
                      + "Take time to think through the approach.",
                  topic)));
    }
    return items;
  }

  static String format(
      PracticeType type, PracticeDifficulty difficulty, List<PracticeItem> items, boolean answers) {
    if (items.isEmpty()) {
      return "No practice items were generated. Please try rephrasing your request.";
    }

    StringBuilder sb = new StringBuilder();
    sb.append("**")
        .append(capitalize(type.getLabel()))
        .append(" - ")
        .append(capitalize(difficulty.getLabel()))
        .append(" Difficulty**\n");
    sb.append('*').append(items.size()).append(" items generated*\n\n");

    int index = 1;
    for (PracticeItem item : items) {
      sb.append("**").append(index++).append(". ").append(item.question()).append("**\n");
      if (answers && item.answer() != null) {
        sb.append("   *Answer:* ").append(item.answer()).append('\n');
        if (item.explanation() != null) {
          sb.append("   *Explanation:* ").append(item.explanation()).append('\n');
        }
      }
      sb.append('\n');
    }

    if (answers) {
      sb.append("---\n*Practice Tips for ").append(difficulty.getLabel()).append(" level:*\n");
      switch (difficulty) {
        case EASY ->
            sb.append("- Take your time and work through each step\n")
                .append("- Don't worry if you make mistakes - that's how you learn!\n");
        case MEDIUM ->
            sb.append("- Break complex problems into smaller steps\n")
                .append("- Check your work and reasoning\n");
        case HARD ->
            sb.append("- Think carefully about the approach before starting\n")
                .append("- Consider multiple solution methods\n");
      }
      sb.append("- Review explanations to understand the concepts better\n");
    }
    return sb.toString();
  }

  private static int clampCount(int count) {
    return Math.max(1, Math.min(count, MAX_ITEMS));
  }

  private static boolean containsAny(String text, String... needles) {
    for (String needle : needles) {
      if (text.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  private static String capitalize(String label) {
    return Character.toUpperCase(label.charAt(0)) + label.substring(1);
  }

  private static Map<String, PracticeType> typeKeywords() {
    Map<String, PracticeType> keywords = new LinkedHashMap<>();
    keywords.put("problem", PracticeType.PROBLEMS);
    keywords.put("math", PracticeType.PROBLEMS);
    keywords.put("quiz", PracticeType.QUIZ);
    keywords.put("test", PracticeType.QUIZ);
    keywords.put("questions", PracticeType.QUIZ);
    keywords.put("exercise", PracticeType.EXERCISES);
    keywords.put("activity", PracticeType.EXERCISES);
    keywords.put("assessment", PracticeType.ASSESSMENT);
    keywords.put("exam", PracticeType.ASSESSMENT);
    keywords.put("evaluation", PracticeType.ASSESSMENT);
    keywords.put("flashcard", PracticeType.FLASHCARDS);
    keywords.put("cards", PracticeType.FLASHCARDS);
    keywords.put("memorize", PracticeType.FLASHCARDS);
    return keywords;
  }
}
