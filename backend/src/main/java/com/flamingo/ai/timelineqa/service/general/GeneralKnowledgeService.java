package com.flamingo.ai.timelineqa.service.general;

import com.flamingo.ai.timelineqa.agent.GeneralKnowledgeAgent;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.service.router.AnswerEngine;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Last-resort engine that answers without personal data. It never throws: when the generation
 * capability is down it reports that it cannot answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneralKnowledgeService implements AnswerEngine {

  private final GeneralKnowledgeAgent agent;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public EngineType type() {
    return EngineType.GENERAL_KNOWLEDGE;
  }

  @Override
  public QueryResult answer(String question, int k) {
    meterRegistry.counter("generation.requests", "agent", "general_knowledge").increment();
    try {
      String answer = agent.answer(question);
      if (answer == null || answer.isBlank()) {
        return QueryResult.unableToAnswer(question);
      }
      return QueryResult.builder()
          .question(question)
          .engineUsed(EngineType.GENERAL_KNOWLEDGE)
          .answer(answer.strip())
          .confidence(qaConfig.getGeneral().getConfidence())
          .sources(List.of())
          .build();
    } catch (RuntimeException e) {
      meterRegistry.counter("generation.failures", "agent", "general_knowledge").increment();
      log.warn("General knowledge generation failed: {}", e.getMessage());
      return QueryResult.unableToAnswer(question);
    }
  }

}
