package com.flamingo.ai.studymate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for intent classification and sub-routing. */
@Configuration
@ConfigurationProperties(prefix = "routing")
@Getter
@Setter
public class RoutingConfig {

  /**
   * Minimum self-reported confidence for a classifier or sub-router decision to be accepted. The
   * same value gates all three routing stages.
   */
  private double confidenceThreshold = 0.6;
}
