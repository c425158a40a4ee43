package com.flamingo.ai.studymate.service.rag;

/** Task instruction placed in the answer generator's template. */
public enum GenerationTask {
  ANSWER(
      """
      Answer the user's request using the context. If the user asks to be tested or quizzed, \
      write questions about the context, each followed by its answer."""),
  SUMMARY(
      """
      Summarize the context with respect to the user's request: the main ideas first, then the \
      key details as a short list.""");

  private final String instruction;

  GenerationTask(String instruction) {
    this.instruction = instruction;
  }

  public String getInstruction() {
    return instruction;
  }
}
