package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.EngineType;

/**
 * An engine the {@link QueryRouter} can dispatch a question to. Engines signal failure by
 * throwing; the router decides what happens next.
 */
public interface AnswerEngine {

  EngineType type();

  /**
   * Answers a question.
   *
   * @param question natural-language question
   * @param k number of episodes to retrieve, where applicable
   * @return a result whose sources are non-empty unless this is the general-knowledge engine
   */
  QueryResult answer(String question, int k);

  /** Whether the engine can currently be attempted at all. */
  default boolean isAvailable() {
    return true;
  }
}
