package com.flamingo.ai.timelineqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for questions that do not depend on the user's personal data. */
public interface GeneralKnowledgeAgent {

  @SystemMessage(
      """
        You are a helpful assistant answering general-knowledge questions briefly (at most three
        sentences). You have no access to the user's personal records; if a question depends on
        them, say that you cannot know.
        """)
  @UserMessage("{{question}}")
  String answer(@V("question") String question);
}
