package com.flamingo.ai.studymate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Generates practice material as JSON. */
public interface PracticeAgent {

  @SystemMessage(
      """
        You create practice material for learners.

        Respond ONLY with JSON:
        {
          "items": [
            {"question": "...", "answer": "...", "explanation": "..."}
          ]
        }

        Rules:
        - Produce exactly the requested number of items of the requested type and difficulty.
        - For flashcards, "question" is the front and "answer" the back.
        - When answers are not wanted, set "answer" to null.
        - Adapt wording to the learner description.
        """)
  @UserMessage(
      """
        Topic: {{topic}}
        Type: {{type}}
        Difficulty: {{difficulty}}
        Number of items: {{count}}
        Include answers: {{includeAnswers}}
        Learner: {{learner}}
        """)
  String generate(
      @V("topic") String topic,
      @V("type") String type,
      @V("difficulty") String difficulty,
      @V("count") int count,
      @V("includeAnswers") boolean includeAnswers,
      @V("learner") String learner);
}
