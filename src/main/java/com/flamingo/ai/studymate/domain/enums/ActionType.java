package com.flamingo.ai.studymate.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Closed vocabulary of workspace actions the dispatcher can execute. */
public enum ActionType {
  OPEN_DOC("open_doc"),
  ADD_NOTE("add_note"),
  OPEN_CHAT("open_chat"),
  CLOSE_CHAT("close_chat"),
  BOOKMARK("bookmark"),
  SHOW_BOOKMARKS("show_bookmarks"),
  NEXT_SECTION("next_section"),
  PREV_SECTION("prev_section"),
  LOCATION("location"),
  OPEN_NOTE("open_note"),
  CLOSE_DOC("close_doc"),
  UNKNOWN("unknown");

  private final String label;

  ActionType(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /** Resolves a router label; unrecognized labels yield empty rather than {@link #UNKNOWN}. */
  public static Optional<ActionType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    if ("previous_section".equals(normalized)) {
      return Optional.of(PREV_SECTION);
    }
    for (ActionType type : values()) {
      if (type.label.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
