package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.agent.ExplanationAgent;
import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import com.flamingo.ai.studymate.domain.enums.ExplanationStyle;
import com.flamingo.ai.studymate.domain.enums.LearningStyle;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
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
 * Writes explanations in a presentation style chosen for the learner.
 *
 * <p>Style selection is ordered: an explicitly requested style, then the learner's stored
 * preference, then struggles (simplified), then grade level, then learning style, then
 * accessibility needs, then analogy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExplanationEngine {

  static final String INVALID_REQUEST =
      "Invalid explanation request format. Please specify the topic to explain.";

  private static final List<Pattern> TOPIC_PATTERNS =
      List.of(
          Pattern.compile("explain\\s+(.+?)(?:\\s+using|\\s+with|\\s+in|$)"),
          Pattern.compile("what\\s+is\\s+(.+?)(?:\\s+using|\\s+with|\\s+in|$)"),
          Pattern.compile("how\\s+(.+?)(?:\\s+works?|\\s+using|\\s+with|\\s+in|$)"),
          Pattern.compile("describe\\s+(.+?)(?:\\s+using|\\s+with|\\s+in|$)"),
          Pattern.compile("topic:\\s*(.+?)(?:\\s+style:|\\s+using:|,|$)"));

  private static final Pattern INSTRUCTION_PREFIX =
      Pattern.compile(
          "^(explain|describe|what is|how does?|tell me about)\\s+", Pattern.CASE_INSENSITIVE);

  private static final Pattern NUMBERED_LINE = Pattern.compile("(?m)^\\d+\\.");

  private final ExplanationAgent explanationAgent;
  private final MeterRegistry meterRegistry;

  /** Parsed natural-language explanation request. */
  public record ExplanationRequest(String topic, ExplanationStyle requestedStyle) {}

  public record ExplanationResult(
      String topic, ExplanationStyle style, String explanation, String formatted) {

    public boolean valid() {
      return style != null;
    }
  }

  /** Parses the request text and explains the topic it names. */
  @Timed(value = "tutoring.explanation", description = "Time to generate an explanation")
  public ExplanationResult explain(String request, LearnerProfile profile) {
    Optional<ExplanationRequest> parsed = parseRequest(request);
    if (parsed.isEmpty()) {
      return new ExplanationResult(null, null, null, INVALID_REQUEST);
    }
    return explain(parsed.get().topic(), parsed.get().requestedStyle(), profile);
  }

  public ExplanationResult explain(
      String topic, ExplanationStyle requestedStyle, LearnerProfile profile) {
    ExplanationStyle style = selectStyle(profile, requestedStyle);
    String explanation = generate(topic, style, profile);
    log.info("Explained '{}' using {} style", topic, style.getLabel());
    meterRegistry.counter("tutoring.explanations", "style", style.getLabel()).increment();
    return new ExplanationResult(topic, style, explanation, format(explanation, style));
  }

  static Optional<ExplanationRequest> parseRequest(String request) {
    if (request == null || request.isBlank()) {
      return Optional.empty();
    }
    String lower = request.toLowerCase(Locale.ROOT);

    String topic = null;
    for (Pattern pattern : TOPIC_PATTERNS) {
      Matcher matcher = pattern.matcher(lower);
      if (matcher.find()) {
        topic = matcher.group(1).trim();
        break;
      }
    }
    if (topic == null) {
      topic = INSTRUCTION_PREFIX.matcher(request.trim()).replaceFirst("").trim();
    }
    if (topic.isEmpty()) {
      return Optional.empty();
    }

    ExplanationStyle requested = null;
    outer:
    for (ExplanationStyle style : ExplanationStyle.values()) {
      for (String keyword : style.getKeywords()) {
        if (lower.contains(keyword)) {
          requested = style;
          break outer;
        }
      }
    }
    return Optional.of(new ExplanationRequest(topic, requested));
  }

  static ExplanationStyle selectStyle(LearnerProfile profile, ExplanationStyle requested) {
    if (requested != null) {
      return requested;
    }
    if (profile == null) {
      return ExplanationStyle.ANALOGY;
    }

    Optional<ExplanationStyle> stored = storedPreference(profile);
    if (stored.isPresent()) {
      return stored.get();
    }
    if (profile.hasStruggles()) {
      return ExplanationStyle.SIMPLIFIED;
    }

    Integer grade = profile.getGradeLevel();
    if (grade != null) {
      if (grade <= 6) {
        return ExplanationStyle.SIMPLIFIED;
      }
      return grade <= 9 ? ExplanationStyle.ANALOGY : ExplanationStyle.DETAILED;
    }

    LearningStyle learningStyle = profile.getLearningStyle();
    if (learningStyle == LearningStyle.VISUAL) {
      return ExplanationStyle.VISUAL;
    }
    if (learningStyle == LearningStyle.KINESTHETIC) {
      return ExplanationStyle.PRACTICAL;
    }
    if (learningStyle == LearningStyle.AUDITORY) {
      return ExplanationStyle.INTERACTIVE;
    }
    if (Boolean.TRUE.equals(profile.getPreferences().get("screen_reader"))) {
      return ExplanationStyle.STEP_BY_STEP;
    }
    return ExplanationStyle.ANALOGY;
  }

  private static Optional<ExplanationStyle> storedPreference(LearnerProfile profile) {
    if (profile.getPreferredExplanationStyles() != null) {
      for (Map<String, Object> entry : profile.getPreferredExplanationStyles()) {
        Object style = entry.get("style");
        Optional<ExplanationStyle> parsed =
            ExplanationStyle.fromLabel(style != null ? style.toString() : null);
        if (parsed.isPresent()) {
          return parsed;
        }
      }
    }
    Object preference =
        profile.getPreferences() != null ? profile.getPreferences().get("explanation_style") : null;
    return ExplanationStyle.fromLabel(preference != null ? preference.toString() : null);
  }

  private String generate(String topic, ExplanationStyle style, LearnerProfile profile) {
    try {
      String text =
          explanationAgent.explain(topic, style.getLabel(), LearnerDescriptions.describe(profile));
      if (text != null && !text.isBlank()) {
        return text.trim();
      }
      log.warn("Explanation agent returned an empty explanation for '{}'", topic);
    } catch (Exception e) {
      log.warn("Explanation generation failed for '{}': {}", topic, e.getMessage());
    }
    meterRegistry.counter("tutoring.fallback", "stage", "explanation").increment();
    return "I understand you want to learn about "
        + topic
        + ". Let me explain this concept in a way that matches your learning style.";
  }

  static String format(String explanation, ExplanationStyle style) {
    String body = explanation.strip();
    if (style == ExplanationStyle.STEP_BY_STEP && !NUMBERED_LINE.matcher(body).find()) {
      body = numberSteps(body);
    }

    StringBuilder formatted =
        new StringBuilder("**").append(style.getTitle()).append(" Explanation:**\n\n").append(body);
    switch (style) {
      case VISUAL -> formatted.append("\n\n*Tip: Try to visualize this concept as you read!*");
      case ANALOGY ->
          formatted.append(
              "\n\n*Remember: Understanding through comparison makes learning easier!*");
      case PRACTICAL ->
          formatted.append(
              "\n\n*Try to think of other real-world examples where this applies!*");
      default -> {
        // no trailer
      }
    }
    return formatted.toString();
  }

  private static String numberSteps(String body) {
    StringBuilder numbered = new StringBuilder();
    int step = 1;
    for (String line : body.split("\n", -1)) {
      if (numbered.length() > 0) {
        numbered.append('\n');
      }
      if (!line.isBlank() && !line.startsWith("*")) {
        numbered.append(step++).append(". ").append(line.strip());
      } else {
        numbered.append(line);
      }
    }
    return numbered.toString();
  }
}
