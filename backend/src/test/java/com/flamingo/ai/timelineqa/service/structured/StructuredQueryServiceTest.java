package com.flamingo.ai.timelineqa.service.structured;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.timelineqa.agent.StructuredQueryAgent;
import com.flamingo.ai.timelineqa.agent.dto.GeneratedQuery;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.domain.enums.SourceKind;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException.Reason;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import com.flamingo.ai.timelineqa.support.TestViews;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StructuredQueryServiceTest {

  private static final String QUESTION = "How many books did I buy in April 2024?";
  private static final String COUNT_SQL =
      "SELECT COUNT(*) AS book_count FROM books"
          + " WHERE date >= '2024-04-01' AND date < '2024-05-01'";

  @Mock private StructuredQueryAgent queryAgent;
  @Mock private StructuredStore structuredStore;

  private SimpleMeterRegistry meterRegistry;
  private StructuredQueryService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = serviceFor(TestViews.withBooks());
  }

  private StructuredQueryService serviceFor(QaConfig qaConfig) {
    StructuredViewRegistry registry = new StructuredViewRegistry(qaConfig);
    return new StructuredQueryService(
        queryAgent,
        registry,
        new QueryValidator(registry),
        structuredStore,
        new ResultVerbalizer(),
        qaConfig,
        meterRegistry);
  }

  private void generatorReturns(GeneratedQuery generated) {
    when(queryAgent.generate(contains("books("), anyString(), anyString())).thenReturn(generated);
  }

  @Nested
  @DisplayName("answering")
  class Answering {

    @Test
    @DisplayName("should verbalize the rows of a validated query")
    void shouldAnswerAggregate() {
      generatorReturns(new GeneratedQuery(true, "books", COUNT_SQL + ";", "count April rows"));
      when(structuredStore.execute(any()))
          .thenReturn(new TabularResult(List.of("book_count"), List.of(List.of(2)), false));

      QueryResult result = service.answer(QUESTION, 5);

      assertThat(result.getEngineUsed()).isEqualTo(EngineType.STRUCTURED);
      assertThat(result.getAnswer())
          .isEqualTo("Based on your books records, the book count is 2.");
      assertThat(result.getConfidence()).isEqualTo(0.9);
      assertThat(result.getGeneratedQuery()).isEqualTo(COUNT_SQL);
      assertThat(result.getSources())
          .singleElement()
          .satisfies(
              s -> {
                assertThat(s.getKind()).isEqualTo(SourceKind.STRUCTURED_VIEW);
                assertThat(s.getId()).isEqualTo("books");
                assertThat(s.getRowCount()).isEqualTo(1);
              });
      assertThat(result.hasRequiredSources()).isTrue();
      assertThat(meterRegistry.counter("structured.query.answered").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should lower confidence when no rows match")
    void shouldLowerConfidenceForEmptyResult() {
      generatorReturns(new GeneratedQuery(true, "books", "SELECT title FROM books", null));
      when(structuredStore.execute(any()))
          .thenReturn(new TabularResult(List.of("title"), List.of(), false));

      QueryResult result = service.answer(QUESTION, 5);

      assertThat(result.getConfidence()).isEqualTo(0.6);
      assertThat(result.getAnswer()).contains("no matching rows");
    }
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    @DisplayName("should be unavailable and refuse to answer without views")
    void shouldFailWithoutViews() {
      StructuredQueryService empty = serviceFor(new QaConfig());

      assertThat(empty.isAvailable()).isFalse();
      assertThatThrownBy(() -> empty.answer(QUESTION, 5))
          .isInstanceOf(QueryGenerationException.class)
          .hasFieldOrPropertyWithValue("reason", Reason.NO_VIEWS);
      verifyNoInteractions(queryAgent);
    }

    @Test
    @DisplayName("should report questions the generator marks unanswerable")
    void shouldFailWhenNotAnswerable() {
      generatorReturns(new GeneratedQuery(false, null, null, "no view tracks moods"));

      assertThatThrownBy(() -> service.answer("How did I feel last week?", 5))
          .isInstanceOf(QueryGenerationException.class)
          .hasFieldOrPropertyWithValue("reason", Reason.NOT_ANSWERABLE)
          .hasMessageContaining("no view tracks moods");
    }

    @Test
    @DisplayName("should wrap generator errors")
    void shouldWrapGeneratorErrors() {
      when(queryAgent.generate(anyString(), anyString(), anyString()))
          .thenThrow(new RuntimeException("model overloaded"));

      assertThatThrownBy(() -> service.answer(QUESTION, 5))
          .isInstanceOf(QueryGenerationException.class)
          .hasFieldOrPropertyWithValue("reason", Reason.GENERATION_FAILED);
      assertThat(
              meterRegistry.counter("generation.failures", "agent", "structured_query").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fail when the generator returns no SQL")
    void shouldFailOnMissingSql() {
      generatorReturns(new GeneratedQuery(true, "books", " ", null));

      assertThatThrownBy(() -> service.answer(QUESTION, 5))
          .hasFieldOrPropertyWithValue("reason", Reason.GENERATION_FAILED);
    }

    @Test
    @DisplayName("should never execute a rejected query")
    void shouldNotExecuteRejectedQuery() {
      generatorReturns(new GeneratedQuery(true, "books", "DROP TABLE books", null));

      assertThatThrownBy(() -> service.answer(QUESTION, 5))
          .isInstanceOf(QueryGenerationException.class)
          .hasFieldOrPropertyWithValue("reason", Reason.VALIDATION_REJECTED);
      verify(structuredStore, never()).execute(any());
      assertThat(meterRegistry.counter("structured.query.rejected").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should propagate store failures")
    void shouldPropagateExecutionFailure() {
      generatorReturns(new GeneratedQuery(true, "books", COUNT_SQL, null));
      when(structuredStore.execute(any()))
          .thenThrow(new QueryGenerationException(Reason.EXECUTION_FAILED, "disk I/O error"));

      assertThatThrownBy(() -> service.answer(QUESTION, 5))
          .hasFieldOrPropertyWithValue("reason", Reason.EXECUTION_FAILED);
    }
  }
}
