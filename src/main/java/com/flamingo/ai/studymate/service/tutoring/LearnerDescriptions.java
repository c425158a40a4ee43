package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import java.util.List;
import java.util.Locale;

/** Renders a learner profile as the short description the completion prompts receive. */
final class LearnerDescriptions {

  private LearnerDescriptions() {}

  static String describe(LearnerProfile profile) {
    if (profile == null) {
      return "No learner profile available. Use a general middle-school level.";
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Grade level: ").append(profile.getGradeLevel()).append('\n');
    sb.append("Learning style: ").append(profile.getLearningStyle().getDisplayName()).append('\n');
    sb.append("Preferred formats: ")
        .append(String.join(", ", profile.getLearningStyle().getPreferredFormats()))
        .append('\n');
    sb.append("Preferred language: ").append(profile.getPreferredLanguage()).append('\n');
    sb.append("Difficulty preference: ").append(profile.getDifficultyPreference()).append('\n');
    if (profile.getAccuracyRate() != null) {
      sb.append(String.format(Locale.ROOT, "Accuracy rate: %.2f", profile.getAccuracyRate()))
          .append('\n');
    }
    List<String> struggles = profile.struggleTopics();
    if (!struggles.isEmpty()) {
      sb.append("Struggles with: ").append(String.join(", ", struggles)).append('\n');
    }
    if (profile.getMasteredTopics() != null && !profile.getMasteredTopics().isEmpty()) {
      sb.append("Mastered topics: ")
          .append(String.join(", ", profile.getMasteredTopics()))
          .append('\n');
    }
    if (profile.isGuestSession()) {
      sb.append("Guest learner: profile inferred from the request wording.\n");
    }
    return sb.toString().trim();
  }
}
