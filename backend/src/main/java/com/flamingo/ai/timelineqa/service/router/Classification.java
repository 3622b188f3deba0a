package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import java.util.List;

/**
 * Outcome of question classification.
 *
 * @param preferred the engine to try first
 * @param personal whether the question is about the user's own life
 * @param aggregateScore count of aggregate markers (counts, totals, date ranges, view mentions)
 * @param descriptiveScore count of descriptive markers (when, where, what happened)
 * @param mentionedViews structured views named in the question
 */
public record Classification(
    EngineType preferred,
    boolean personal,
    int aggregateScore,
    int descriptiveScore,
    List<String> mentionedViews) {

  public Classification {
    mentionedViews = mentionedViews == null ? List.of() : List.copyOf(mentionedViews);
  }
}
