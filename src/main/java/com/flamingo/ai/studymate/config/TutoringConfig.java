package com.flamingo.ai.studymate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the tutoring layer. */
@Configuration
@ConfigurationProperties(prefix = "tutoring")
@Getter
@Setter
public class TutoringConfig {

  /** Entries kept in a tutoring session's interaction history. */
  private int historyLimit = 50;

  /** Recent difficulty ratings kept in the learning-progress summary. */
  private int difficultyRatingsLimit = 20;

  /** Characters of query/response text kept in history summaries. */
  private int summaryMaxChars = 200;

  private int defaultPracticeItems = 5;
}
