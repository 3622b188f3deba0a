package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Answer to one question, with the evidence and the routing trace that produced it. */
@Getter
@Builder(toBuilder = true)
public class QueryResult {

  public static final String UNABLE_TO_ANSWER =
      "I'm unable to answer that right now: the answer depends on services that are currently"
          + " unavailable.";

  private final String question;
  private final EngineType engineUsed;
  private final String answer;

  /** Confidence in [0, 1]. */
  private final double confidence;

  @Builder.Default private final List<SourceReference> sources = List.of();

  /** The executed query, for structured answers. */
  private final String generatedQuery;

  /** Whether the answer came from a fallback or a degraded path. */
  private final boolean degraded;

  private final RouteTrace trace;

  /** Explicit inability result of the general-knowledge engine: no sources, zero confidence. */
  public static QueryResult unableToAnswer(String question) {
    return QueryResult.builder()
        .question(question)
        .engineUsed(EngineType.GENERAL_KNOWLEDGE)
        .answer(UNABLE_TO_ANSWER)
        .confidence(0.0)
        .sources(List.of())
        .degraded(true)
        .build();
  }

  /** Whether the result satisfies the evidence rule for its engine. */
  public boolean hasRequiredSources() {
    return engineUsed == EngineType.GENERAL_KNOWLEDGE || (sources != null && !sources.isEmpty());
  }
}
