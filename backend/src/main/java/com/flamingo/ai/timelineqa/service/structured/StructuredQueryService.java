package com.flamingo.ai.timelineqa.service.structured;

import com.flamingo.ai.timelineqa.agent.StructuredQueryAgent;
import com.flamingo.ai.timelineqa.agent.dto.GeneratedQuery;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException.Reason;
import com.flamingo.ai.timelineqa.service.router.AnswerEngine;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import com.flamingo.ai.timelineqa.service.router.SourceReference;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers aggregate questions by generating a query over one registered view, validating it,
 * running it against the read-only store and verbalizing the rows. Every failure surfaces as a
 * {@link QueryGenerationException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredQueryService implements AnswerEngine {

  private final StructuredQueryAgent queryAgent;
  private final StructuredViewRegistry viewRegistry;
  private final QueryValidator queryValidator;
  private final StructuredStore structuredStore;
  private final ResultVerbalizer resultVerbalizer;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public EngineType type() {
    return EngineType.STRUCTURED;
  }

  @Override
  public boolean isAvailable() {
    return !viewRegistry.isEmpty();
  }

  @Override
  @Timed(value = "structured.query", description = "Time to answer through structured views")
  public QueryResult answer(String question, int k) {
    if (viewRegistry.isEmpty()) {
      throw new QueryGenerationException(Reason.NO_VIEWS, "No structured views are registered");
    }

    GeneratedQuery generated = generate(question);
    if (generated == null || !generated.answerable()) {
      meterRegistry.counter("structured.query.not_answerable").increment();
      throw new QueryGenerationException(
          Reason.NOT_ANSWERABLE,
          "Question cannot be answered from structured views"
              + (generated != null && generated.reasoning() != null
                  ? ": " + generated.reasoning()
                  : ""));
    }
    if (generated.sql() == null || generated.sql().isBlank()) {
      throw new QueryGenerationException(Reason.GENERATION_FAILED, "Generator returned no SQL");
    }

    ValidatedQuery query;
    try {
      query = queryValidator.validate(generated.sql(), generated.view());
    } catch (QueryGenerationException e) {
      meterRegistry.counter("structured.query.rejected").increment();
      log.warn("Generated query rejected: {} | sql={}", e.getMessage(), generated.sql());
      throw e;
    }

    TabularResult result = structuredStore.execute(query);
    String answer = resultVerbalizer.verbalize(query.view(), result);
    QaConfig.Structured config = qaConfig.getStructured();
    double confidence =
        result.isEmpty() ? config.getEmptyResultConfidence() : config.getConfidence();

    meterRegistry.counter("structured.query.answered").increment();
    log.debug("Structured answer from {} ({} rows)", query.view().name(), result.rows().size());
    return QueryResult.builder()
        .question(question)
        .engineUsed(EngineType.STRUCTURED)
        .answer(answer)
        .confidence(confidence)
        .sources(
            List.of(SourceReference.view(query.view().name(), result.rows().size(), query.sql())))
        .generatedQuery(query.sql())
        .build();
  }

  private GeneratedQuery generate(String question) {
    meterRegistry.counter("generation.requests", "agent", "structured_query").increment();
    String today = LocalDate.now(ZoneId.of(qaConfig.getIngestion().getDefaultZone())).toString();
    try {
      return queryAgent.generate(viewRegistry.describeSchemas(), today, question);
    } catch (RuntimeException e) {
      meterRegistry.counter("generation.failures", "agent", "structured_query").increment();
      throw new QueryGenerationException(
          Reason.GENERATION_FAILED, "Query generation failed: " + e.getMessage(), e);
    }
  }
}
