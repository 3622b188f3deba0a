package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.domain.enums.RouterState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.Getter;

/**
 * Audit record of how one question moved through the router. Filled in by the routing thread,
 * then only read.
 */
@Getter
public class RouteTrace {

  private final String traceId;
  private final String question;
  private final Instant startedAt;
  private Instant finishedAt;
  private RouterState finalState;
  private EngineType engineUsed;
  private EngineType preferredEngine;
  private boolean personal;

  private final List<StateTransition> transitions = new ArrayList<>();
  private final List<EngineAttempt> attempts = new ArrayList<>();

  public RouteTrace(String question) {
    this.traceId = UUID.randomUUID().toString();
    this.question = question;
    this.startedAt = Instant.now();
  }

  public List<StateTransition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public List<EngineAttempt> getAttempts() {
    return Collections.unmodifiableList(attempts);
  }

  public long getDurationMs() {
    Instant end = finishedAt != null ? finishedAt : Instant.now();
    return Duration.between(startedAt, end).toMillis();
  }

  /** Whether the given engine has been dispatched to. */
  public boolean attempted(EngineType engine) {
    return attempts.stream().anyMatch(a -> a.engine() == engine);
  }

  void classified(EngineType preferred, boolean personalQuestion) {
    this.preferredEngine = preferred;
    this.personal = personalQuestion;
  }

  void transition(RouterState from, RouterState to, String reason) {
    transitions.add(new StateTransition(from, to, reason));
  }

  void attempt(EngineAttempt attempt) {
    attempts.add(attempt);
  }

  void finish(RouterState state, EngineType engine) {
    this.finalState = state;
    this.engineUsed = engine;
    this.finishedAt = Instant.now();
  }
}
