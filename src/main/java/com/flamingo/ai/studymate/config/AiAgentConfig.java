package com.flamingo.ai.studymate.config;

import com.flamingo.ai.studymate.agent.ActionRouterAgent;
import com.flamingo.ai.studymate.agent.ContentAssistantAgent;
import com.flamingo.ai.studymate.agent.ExplanationAgent;
import com.flamingo.ai.studymate.agent.IntentClassificationAgent;
import com.flamingo.ai.studymate.agent.PracticeAgent;
import com.flamingo.ai.studymate.agent.QueryRouterAgent;
import com.flamingo.ai.studymate.agent.TutorAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Routing and practice agents use the JSON-mode chat model; agents that write prose for the
 * learner use textChatModel.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public IntentClassificationAgent intentClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(IntentClassificationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ActionRouterAgent actionRouterAgent(ChatModel chatModel) {
    return AiServices.builder(ActionRouterAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public QueryRouterAgent queryRouterAgent(ChatModel chatModel) {
    return AiServices.builder(QueryRouterAgent.class).chatModel(chatModel).build();
  }

  /** Practice items are parsed from JSON, so this agent stays on the JSON-mode model. */
  @Bean
  public PracticeAgent practiceAgent(ChatModel chatModel) {
    return AiServices.builder(PracticeAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ContentAssistantAgent contentAssistantAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(ContentAssistantAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public TutorAgent tutorAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(TutorAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public ExplanationAgent explanationAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(ExplanationAgent.class).chatModel(textChatModel).build();
  }
}
