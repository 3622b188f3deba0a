package com.flamingo.ai.timelineqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that answers a personal question from retrieved timeline episodes and cites the
 * episodes it used.
 */
public interface EpisodeAnswerAgent {

  @SystemMessage(
      """
        You answer questions about the user's own life using ONLY the timeline episodes provided.
        Each episode line has the form: [episode id] date | source type | description.

        Rules:
        1. Answer in one to three sentences, in the second person ("You visited ...").
        2. Use only facts stated in the episodes. Prefer the most recent matching episode when the
           question asks about the last or latest occurrence.
        3. If the episodes do not contain the answer, say so plainly.
        4. End your reply with a final line of the form:
           SOURCES: <episode id>, <episode id>
           listing only ids of episodes you actually used.
        """)
  @UserMessage(
      """
        Timeline episodes:
        {{episodes}}

        Question: {{question}}
        """)
  String answer(@V("question") String question, @V("episodes") String episodes);

  @SystemMessage(
      """
        You answer questions about the user's own life using ONLY the timeline episodes provided.
        Each episode line has the form: [episode id] date | source type | description.

        Your previous reply could not be used because it lacked a valid SOURCES line.
        Follow this format exactly:
        <answer in one to three sentences>
        SOURCES: <comma-separated episode ids>

        The SOURCES line is mandatory, must be the last line, and may contain only these ids:
        {{allowedIds}}
        """)
  @UserMessage(
      """
        Timeline episodes:
        {{episodes}}

        Question: {{question}}
        """)
  String answerStrictly(
      @V("question") String question,
      @V("episodes") String episodes,
      @V("allowedIds") String allowedIds);
}
