package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds an in-memory learner profile from the wording of a guest's request.
 *
 * <p>Each characteristic is decided by an ordered rule table where the first matching rule wins.
 * The result depends on the query text alone.
 */
@Component
public class GuestProfileInference {

  private static final Pattern EXPLICIT_GRADE =
      Pattern.compile("(\\d+)\\s*(?:st|nd|rd|th)?\\s*grade");

  static final int DEFAULT_GRADE = 8;

  private static final List<Rule<Integer>> GRADE_RULES =
      List.of(
          new Rule<>(anyOf("kindergarten", "preschool", "abc", "counting"), 1),
          new Rule<>(anyOf("elementary", "addition", "subtraction"), 4),
          new Rule<>(anyOf("middle school", "algebra").and(q -> !q.contains("fraction")), 8),
          // "ap" is a plain substring match, so words like "map" count as high school
          new Rule<>(
              anyOf("high school", "ap", "trigonometry", "calculus", "chemistry", "physics"), 11),
          new Rule<>(anyOf("college", "university", "theoretical", "complex analysis"), 16),
          new Rule<>(
              anyOf("fraction").and(anyOf("3rd", "4th", "elementary", "simple")), 4),
          new Rule<>(anyOf("fraction"), 8));

  private static final List<Rule<LearningStyle>> STYLE_RULES =
      List.of(
          new Rule<>(
              anyOf("show me", "diagram", "picture", "visual", "see", "draw", "chart"),
              LearningStyle.VISUAL),
          new Rule<>(
              anyOf("explain", "tell me", "talk", "listen", "hear", "discuss"),
              LearningStyle.AUDITORY),
          new Rule<>(
              anyOf("hands-on", "practice", "do", "try", "interactive", "game"),
              LearningStyle.KINESTHETIC),
          new Rule<>(
              anyOf("analyze", "prove", "theory", "logic", "detailed"), LearningStyle.ANALYTICAL),
          new Rule<>(anyOf("creative", "imagine", "design", "artistic"), LearningStyle.CREATIVE));

  private static final List<Rule<String>> DIFFICULTY_RULES =
      List.of(
          new Rule<>(
              anyOf(
                  "simple",
                  "easy",
                  "basic",
                  "confused",
                  "confusing",
                  "don't understand",
                  "hard for me",
                  "help me",
                  "struggling"),
              "easy"),
          new Rule<>(
              anyOf(
                  "challenging",
                  "advanced",
                  "complex",
                  "difficult",
                  "in-depth",
                  "theoretical",
                  "rigorous"),
              "challenging"));

  // checked against the original-case query
  private static final List<Rule<String>> LANGUAGE_RULES =
      List.of(
          new Rule<>(anyOf("español", "¿", "¡", "por favor", "gracias"), "Spanish"),
          new Rule<>(anyOf("العربية", "عربي", "أريد"), "Arabic"));

  private static final Map<String, List<String>> GRADE_INDICATORS = new LinkedHashMap<>();
  private static final Map<String, List<String>> STYLE_INDICATORS = new LinkedHashMap<>();
  private static final Map<String, List<String>> DIFFICULTY_INDICATORS = new LinkedHashMap<>();

  static {
    GRADE_INDICATORS.put("elementary", List.of("elementary", "basic", "simple", "counting"));
    GRADE_INDICATORS.put("middle", List.of("middle", "algebra", "fraction", "geometry"));
    GRADE_INDICATORS.put(
        "high", List.of("high school", "trigonometry", "calculus", "chemistry", "physics"));
    GRADE_INDICATORS.put(
        "college", List.of("college", "university", "advanced", "complex", "theoretical"));

    STYLE_INDICATORS.put(
        "visual", List.of("show", "see", "diagram", "picture", "chart", "visual", "draw"));
    STYLE_INDICATORS.put("auditory", List.of("explain", "tell", "discuss", "listen", "hear"));
    STYLE_INDICATORS.put(
        "kinesthetic", List.of("do", "practice", "hands-on", "interactive", "game"));
    STYLE_INDICATORS.put(
        "analytical", List.of("analyze", "prove", "theory", "logic", "detailed"));
    STYLE_INDICATORS.put("creative", List.of("creative", "imagine", "design", "artistic"));

    DIFFICULTY_INDICATORS.put(
        "easy",
        List.of(
            "simple",
            "easy",
            "basic",
            "confused",
            "confusing",
            "don't understand",
            "help me",
            "struggling"));
    DIFFICULTY_INDICATORS.put(
        "hard",
        List.of(
            "challenging",
            "advanced",
            "complex",
            "difficult",
            "in-depth",
            "theoretical",
            "rigorous"));
  }

  /** Infers a guest profile; the returned profile is flagged as a guest and must not be saved. */
  public InferredProfile infer(String guestId, String query) {
    String original = query != null ? query : "";
    String lower = original.toLowerCase(Locale.ROOT);

    int grade = inferGrade(lower);
    LearningStyle style = firstMatch(STYLE_RULES, lower, LearningStyle.MIXED);
    String difficulty = firstMatch(DIFFICULTY_RULES, lower, "medium");
    String language = firstMatch(LANGUAGE_RULES, original, "English");

    Map<String, Object> interactionPatterns = new LinkedHashMap<>();
    interactionPatterns.put("preferred_formats", style.getPreferredFormats());
    interactionPatterns.put("session_type", "exploration");
    interactionPatterns.put("guest_session", true);

    List<Map<String, Object>> explanationStyles = new ArrayList<>();
    explanationStyles.add(styleEntry(style.getDisplayName().toLowerCase(Locale.ROOT), 0.9));
    explanationStyles.add(styleEntry("encouraging", 0.8));

    LearnerProfile profile =
        LearnerProfile.builder()
            .id(guestId)
            .name("Guest Learner")
            .gradeLevel(grade)
            .learningStyle(style)
            .preferredLanguage(language)
            .difficultyPreference(difficulty)
            .accuracyRate(0.7)
            .avgResponseTime(15.0)
            .completionRate(0.8)
            .totalSessions(0)
            .interactionPatterns(interactionPatterns)
            .preferredExplanationStyles(explanationStyles)
            .guestSession(true)
            .build();

    Map<String, List<String>> indicators = new LinkedHashMap<>();
    indicators.put("grade_level_indicators", matchedIndicators(GRADE_INDICATORS, lower));
    indicators.put("learning_style_indicators", matchedIndicators(STYLE_INDICATORS, lower));
    indicators.put("difficulty_indicators", matchedIndicators(DIFFICULTY_INDICATORS, lower));
    return new InferredProfile(profile, indicators);
  }

  static int inferGrade(String lower) {
    Matcher explicit = EXPLICIT_GRADE.matcher(lower);
    if (explicit.find()) {
      try {
        return Integer.parseInt(explicit.group(1));
      } catch (NumberFormatException e) {
        return DEFAULT_GRADE;
      }
    }
    return firstMatch(GRADE_RULES, lower, DEFAULT_GRADE);
  }

  private static <T> T firstMatch(List<Rule<T>> rules, String text, T defaultValue) {
    for (Rule<T> rule : rules) {
      if (rule.predicate().test(text)) {
        return rule.result();
      }
    }
    return defaultValue;
  }

  private static List<String> matchedIndicators(Map<String, List<String>> table, String lower) {
    List<String> matched = new ArrayList<>();
    table.forEach(
        (level, words) -> {
          for (String word : words) {
            if (lower.contains(word)) {
              matched.add(level + ":" + word);
            }
          }
        });
    return matched;
  }

  private static Map<String, Object> styleEntry(String style, double effectiveness) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("style", style);
    entry.put("effectiveness", effectiveness);
    return entry;
  }

  private static Predicate<String> anyOf(String... keywords) {
    return text -> {
      for (String keyword : keywords) {
        if (text.contains(keyword)) {
          return true;
        }
      }
      return false;
    };
  }

  private record Rule<T>(Predicate<String> predicate, T result) {}

  /** An inferred guest profile with the keyword cues that were found in the query. */
  public record InferredProfile(LearnerProfile profile, Map<String, List<String>> indicators) {}
}
