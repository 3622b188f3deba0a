package com.flamingo.ai.timelineqa.agent;

import com.flamingo.ai.timelineqa.agent.dto.GeneratedQuery;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that turns a question into one read-only SQL query over a registered aggregate view.
 * Uses LangChain4j AI Services for structured JSON output.
 */
public interface StructuredQueryAgent {

  @SystemMessage(
      """
        You translate questions about a person's timeline into a single SQLite SELECT statement
        over exactly one of the views described below.

        Views:
        {{schemas}}

        Rules:
        1. Use exactly one view. No joins, subqueries, UNION, WITH, comments or parameters.
        2. Reference only the listed columns. Give computed columns a short alias,
           e.g. SELECT COUNT(*) AS book_count.
        3. Dates are ISO-8601 text (YYYY-MM-DD); compare them as strings, e.g.
           date >= '2024-04-01' AND date < '2024-05-01'.
        4. If no view can answer the question, set answerable=false and leave sql empty.

        Today's date is {{today}}.

        Return JSON with these fields:
        - answerable (boolean)
        - view (string) - the view queried
        - sql (string) - the SELECT statement
        - reasoning (string) - one sentence explaining the query
        """)
  @UserMessage("Question: {{question}}")
  GeneratedQuery generate(
      @V("schemas") String schemas, @V("today") String today, @V("question") String question);
}
