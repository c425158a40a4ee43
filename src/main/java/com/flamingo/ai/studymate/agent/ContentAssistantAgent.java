package com.flamingo.ai.studymate.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** General content assistant for explanations, learning units and free-form questions. */
public interface ContentAssistantAgent {

  @SystemMessage(
      """
        You are a content assistant inside a study application. You explain concepts, break
        material into learning units and answer general questions.

        Rules:
        - When document excerpts are provided, ground your answer in them and say which excerpt
          you relied on.
        - When no excerpts are provided, answer from general knowledge and keep it accurate.
        - Follow the language instruction at the start of the request.
        - Prefer short paragraphs and lists over long blocks of text.
        """)
  @UserMessage(
      """
        {{request}}

        Document excerpts:
        {{context}}
        """)
  String respond(@V("request") String request, @V("context") String context);
}
