package com.flamingo.ai.studymate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Adaptive tutor that tailors a reply to a learner profile. */
public interface TutorAgent {

  @SystemMessage(
      """
        You are a patient, encouraging tutor. Adapt every reply to the learner profile you are
        given: match the grade level, favor the learning style, respect the preferred language
        and difficulty, and give extra scaffolding on topics the learner struggles with.

        If a previous content answer is included, improve on it for this learner instead of
        repeating it. Finish with one short question that checks understanding.
        """)
  @UserMessage(
      """
        Learner profile:
        {{profile}}

        {{context}}
        """)
  String tutor(@V("profile") String profile, @V("context") String context);
}
