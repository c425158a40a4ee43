package com.flamingo.ai.studymate.service.routing;

/** Arguments the action router extracted from the utterance; every field is optional. */
public record ActionArguments(String docId, Integer pageNum, String noteText) {

  public static ActionArguments none() {
    return new ActionArguments(null, null, null);
  }
}
