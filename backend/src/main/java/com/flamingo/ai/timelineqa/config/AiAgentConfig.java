package com.flamingo.ai.timelineqa.config;

import com.flamingo.ai.timelineqa.agent.EpisodeAnswerAgent;
import com.flamingo.ai.timelineqa.agent.GeneralKnowledgeAgent;
import com.flamingo.ai.timelineqa.agent.StructuredQueryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for reusable AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Structured query agent. Uses the JSON-mode chat model for structured output. */
  @Bean
  public StructuredQueryAgent structuredQueryAgent(
      @Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(StructuredQueryAgent.class).chatModel(chatModel).build();
  }

  /**
   * Episode answer agent for grounded, cited answers. Uses textChatModel (no JSON response format)
   * so the SOURCES line survives verbatim.
   */
  @Bean
  public EpisodeAnswerAgent episodeAnswerAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(EpisodeAnswerAgent.class).chatModel(textChatModel).build();
  }

  /** General knowledge agent for the last-resort fallback. Uses textChatModel. */
  @Bean
  public GeneralKnowledgeAgent generalKnowledgeAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(GeneralKnowledgeAgent.class).chatModel(textChatModel).build();
  }
}
