package com.flamingo.ai.studymate.service.tutoring;

import com.flamingo.ai.studymate.domain.entity.LearnerProfile;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-request tutoring state: who the learner is, the profile in use and the session the turn
 * belongs to. Never shared across requests.
 */
@Getter
@Setter
@Builder
public class TutoringContext {

  private final String learnerId;

  private LearnerProfile profile;

  /** Active tutoring session of a registered learner. */
  private UUID tutoringSessionId;

  /** Synthetic session id of a guest, never persisted. */
  private String guestSessionId;

  public boolean isGuest() {
    return (profile != null && profile.isGuestSession()) || LearnerProfile.isGuestId(learnerId);
  }

  /** Session identifier for responses: the tutoring session id or the guest's synthetic id. */
  public String sessionReference() {
    if (isGuest()) {
      return guestSessionId;
    }
    return tutoringSessionId != null ? tutoringSessionId.toString() : null;
  }
}
