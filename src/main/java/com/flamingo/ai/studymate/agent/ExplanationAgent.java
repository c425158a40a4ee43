package com.flamingo.ai.studymate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Writes an explanation of a topic in a requested presentation style. */
public interface ExplanationAgent {

  @SystemMessage(
      """
        You write explanations for learners. Use exactly the requested style:
        - simplified: short sentences, everyday words, one idea at a time
        - detailed: thorough coverage with definitions and edge cases
        - analogy: build the explanation around a familiar comparison
        - step-by-step: numbered steps, each building on the previous one
        - visual: describe diagrams, tables or mental pictures the learner can draw
        - interactive: pose small questions and let the learner predict before revealing
        - practical: anchor every idea in a real-world use or hands-on task
        Do not add a heading; the caller adds one.
        """)
  @UserMessage(
      """
        Topic: {{topic}}
        Style: {{style}}
        Learner: {{learner}}
        """)
  String explain(
      @V("topic") String topic, @V("style") String style, @V("learner") String learner);
}
