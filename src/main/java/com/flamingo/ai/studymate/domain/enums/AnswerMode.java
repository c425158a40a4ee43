package com.flamingo.ai.studymate.domain.enums;

/** Output shape produced by the answer generator for knowledge routes. */
public enum AnswerMode {
  /** Plain text answer. */
  TEXT,

  /** Loosely typed JSON with {@code response}, {@code sources_referenced} and confidence. */
  JSON,

  /** Schema-constrained learning unit. */
  LEARNING_UNIT
}
