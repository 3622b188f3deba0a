package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.domain.enums.ErrorKind;
import com.flamingo.ai.timelineqa.domain.enums.RouterState;
import com.flamingo.ai.timelineqa.exception.EmbeddingProviderException;
import com.flamingo.ai.timelineqa.exception.InsufficientEvidenceException;
import com.flamingo.ai.timelineqa.exception.LlmServiceException;
import com.flamingo.ai.timelineqa.exception.ProviderTimeoutException;
import com.flamingo.ai.timelineqa.exception.QueryCancelledException;
import com.flamingo.ai.timelineqa.exception.QueryFailedException;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Routes a question across the answer engines.
 *
 * <p>States: CLASSIFY picks the preferred engine; TRY_STRUCTURED and TRY_RETRIEVAL fall back to
 * each other at most once; a non-personal question then falls through to TRY_GENERAL; a personal
 * question ends in FAILED unless retrieval was down and degraded general answers are enabled, in
 * which case the general state reports inability without consulting the model. Each engine is
 * attempted at most once per question and runs on the engine executor under its own timeout.
 */
@Service
@Slf4j
public class QueryRouter {

  private final Map<EngineType, AnswerEngine> engines = new EnumMap<>(EngineType.class);
  private final QuestionClassifier classifier;
  private final AsyncTaskExecutor engineExecutor;
  private final QueryAuditLog auditLog;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  public QueryRouter(
      List<AnswerEngine> answerEngines,
      QuestionClassifier classifier,
      @Qualifier("engineExecutor") AsyncTaskExecutor engineExecutor,
      QueryAuditLog auditLog,
      QaConfig qaConfig,
      MeterRegistry meterRegistry) {
    for (AnswerEngine engine : answerEngines) {
      AnswerEngine previous = engines.put(engine.type(), engine);
      if (previous != null) {
        throw new IllegalStateException("Duplicate answer engine for " + engine.type());
      }
    }
    this.classifier = classifier;
    this.engineExecutor = engineExecutor;
    this.auditLog = auditLog;
    this.qaConfig = qaConfig;
    this.meterRegistry = meterRegistry;
    log.info("Query router initialized with engines {}", engines.keySet());
  }

  /**
   * Answers a question.
   *
   * @param question the natural-language question
   * @param k retrieval depth; zero or negative selects the configured default
   * @return the answer, with its route trace attached
   * @throws QueryFailedException when every applicable engine failed
   * @throws QueryCancelledException when the calling thread is interrupted
   */
  @Timed(value = "qa.router.route", description = "Time to route and answer a question")
  public QueryResult route(String question, int k) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    String normalized = question.strip();
    RouteTrace trace = new RouteTrace(normalized);
    Classification classification = classifier.classify(normalized);
    trace.classified(classification.preferred(), classification.personal());

    RouterState state = RouterState.CLASSIFY;
    RouterState next =
        classification.preferred() == EngineType.STRUCTURED && isAvailable(EngineType.STRUCTURED)
            ? RouterState.TRY_STRUCTURED
            : RouterState.TRY_RETRIEVAL;
    state = move(trace, state, next, "preferred " + classification.preferred());

    QueryResult result = null;
    ErrorKind retrievalFailure = null;

    while (!state.isTerminal()) {
      switch (state) {
        case TRY_STRUCTURED -> {
          Outcome outcome = attempt(EngineType.STRUCTURED, normalized, k, trace);
          if (outcome.result() != null) {
            result = outcome.result();
            state = move(trace, state, RouterState.DONE, "structured answered");
          } else if (!trace.attempted(EngineType.RETRIEVAL)) {
            state =
                move(
                    trace,
                    state,
                    RouterState.TRY_RETRIEVAL,
                    "structured failed: " + outcome.errorKind());
          } else {
            state =
                move(
                    trace,
                    state,
                    afterTimelineExhausted(classification, retrievalFailure),
                    "structured failed after retrieval: " + outcome.errorKind());
          }
        }
        case TRY_RETRIEVAL -> {
          Outcome outcome = attempt(EngineType.RETRIEVAL, normalized, k, trace);
          if (outcome.result() != null) {
            result = outcome.result();
            state = move(trace, state, RouterState.DONE, "retrieval answered");
          } else {
            retrievalFailure = outcome.errorKind();
            if (retrievalFailure.isProviderOutage()
                && !trace.attempted(EngineType.STRUCTURED)
                && isAvailable(EngineType.STRUCTURED)) {
              state =
                  move(
                      trace,
                      state,
                      RouterState.TRY_STRUCTURED,
                      "retrieval unavailable: " + retrievalFailure);
            } else {
              state =
                  move(
                      trace,
                      state,
                      afterTimelineExhausted(classification, retrievalFailure),
                      "retrieval failed: " + retrievalFailure);
            }
          }
        }
        case TRY_GENERAL -> {
          result = answerGenerally(normalized, k, classification.personal(), trace);
          state = move(trace, state, RouterState.DONE, "general engine responded");
        }
        default -> throw new IllegalStateException("Unexpected router state " + state);
      }
    }

    if (state == RouterState.FAILED) {
      trace.finish(RouterState.FAILED, null);
      auditLog.record(trace);
      meterRegistry.counter("qa.router.outcome", "state", "failed", "engine", "none").increment();
      log.info(
          "Question failed after {} attempt(s) in {}ms [trace={}]",
          trace.getAttempts().size(),
          trace.getDurationMs(),
          trace.getTraceId());
      throw new QueryFailedException(trace);
    }

    trace.finish(RouterState.DONE, result.getEngineUsed());
    auditLog.record(trace);
    boolean fellBack = trace.getAttempts().stream().anyMatch(a -> !a.success());
    meterRegistry
        .counter(
            "qa.router.outcome",
            "state",
            "done",
            "engine",
            result.getEngineUsed().name().toLowerCase(Locale.ROOT))
        .increment();
    log.info(
        "Question answered by {} in {}ms (fallback={}) [trace={}]",
        result.getEngineUsed(),
        trace.getDurationMs(),
        fellBack,
        trace.getTraceId());
    return result.toBuilder()
        .question(normalized)
        .degraded(result.isDegraded() || fellBack)
        .trace(trace)
        .build();
  }

  private RouterState afterTimelineExhausted(Classification classification, ErrorKind failure) {
    if (!classification.personal()) {
      return RouterState.TRY_GENERAL;
    }
    if (failure != null
        && failure.isProviderOutage()
        && qaConfig.getRouter().isDegradedGeneralForPersonal()) {
      return RouterState.TRY_GENERAL;
    }
    return RouterState.FAILED;
  }

  private QueryResult answerGenerally(String question, int k, boolean personal, RouteTrace trace) {
    if (personal) {
      // Personal facts cannot come from world knowledge; report inability instead.
      trace.attempt(
          new EngineAttempt(
              EngineType.GENERAL_KNOWLEDGE, true, null, "inability reported", 0L));
      recordAttempt(EngineType.GENERAL_KNOWLEDGE, "inability");
      return QueryResult.unableToAnswer(question);
    }
    Outcome outcome = attempt(EngineType.GENERAL_KNOWLEDGE, question, k, trace);
    return outcome.result() != null ? outcome.result() : QueryResult.unableToAnswer(question);
  }

  private Outcome attempt(EngineType type, String question, int k, RouteTrace trace) {
    AnswerEngine engine = engines.get(type);
    if (engine == null || !engine.isAvailable()) {
      return failed(type, ErrorKind.ENGINE_UNAVAILABLE, type + " engine unavailable", 0L, trace);
    }

    long start = System.nanoTime();
    Future<QueryResult> future;
    try {
      future = engineExecutor.submit(() -> engine.answer(question, k));
    } catch (RejectedExecutionException e) {
      // TaskRejectedException is a RejectedExecutionException
      log.warn("Engine executor rejected the {} attempt: {}", type, e.getMessage());
      return failed(
          type, ErrorKind.ENGINE_UNAVAILABLE, "engine executor saturated", elapsedMs(start), trace);
    }
    try {
      QueryResult result = future.get(timeoutFor(type), TimeUnit.MILLISECONDS);
      long elapsed = elapsedMs(start);
      if (result == null || !result.hasRequiredSources()) {
        return failed(type, ErrorKind.INVALID_RESULT, "result without sources", elapsed, trace);
      }
      trace.attempt(new EngineAttempt(type, true, null, null, elapsed));
      recordAttempt(type, "success");
      return new Outcome(result, null);
    } catch (TimeoutException e) {
      future.cancel(true);
      ProviderTimeoutException timeout =
          new ProviderTimeoutException(
              type.name(), type + " engine exceeded " + timeoutFor(type) + "ms", e);
      return failed(
          type, ErrorKind.PROVIDER_TIMEOUT, timeout.getMessage(), elapsedMs(start), trace);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new QueryCancelledException(question, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      ErrorKind kind = errorKindOf(cause);
      if (kind == ErrorKind.UNEXPECTED) {
        log.error("{} engine failed unexpectedly", type, cause);
      }
      return failed(type, kind, cause.getMessage(), elapsedMs(start), trace);
    }
  }

  private Outcome failed(
      EngineType type, ErrorKind kind, String message, long elapsedMs, RouteTrace trace) {
    log.info("{} engine failed ({}): {}", type, kind, message);
    trace.attempt(new EngineAttempt(type, false, kind, message, elapsedMs));
    recordAttempt(type, kind.name().toLowerCase(Locale.ROOT));
    return new Outcome(null, kind);
  }

  static ErrorKind errorKindOf(Throwable error) {
    if (error instanceof QueryGenerationException) {
      return ErrorKind.QUERY_GENERATION;
    }
    if (error instanceof InsufficientEvidenceException) {
      return ErrorKind.INSUFFICIENT_EVIDENCE;
    }
    if (error instanceof EmbeddingProviderException) {
      return ErrorKind.EMBEDDING_PROVIDER;
    }
    if (error instanceof ProviderTimeoutException) {
      return ErrorKind.PROVIDER_TIMEOUT;
    }
    if (error instanceof LlmServiceException) {
      return ErrorKind.GENERATION_PROVIDER;
    }
    return ErrorKind.UNEXPECTED;
  }

  private boolean isAvailable(EngineType type) {
    AnswerEngine engine = engines.get(type);
    return engine != null && engine.isAvailable();
  }

  private long timeoutFor(EngineType type) {
    QaConfig.Router router = qaConfig.getRouter();
    return switch (type) {
      case STRUCTURED -> router.getStructuredTimeoutMs();
      case RETRIEVAL -> router.getRetrievalTimeoutMs();
      case GENERAL_KNOWLEDGE -> router.getGeneralTimeoutMs();
    };
  }

  private RouterState move(RouteTrace trace, RouterState from, RouterState to, String reason) {
    log.debug("Router {} -> {} ({})", from, to, reason);
    trace.transition(from, to, reason);
    return to;
  }

  private void recordAttempt(EngineType type, String outcome) {
    meterRegistry
        .counter(
            "qa.router.attempts",
            "engine",
            type.name().toLowerCase(Locale.ROOT),
            "outcome",
            outcome)
        .increment();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private record Outcome(QueryResult result, ErrorKind errorKind) {}
}
