package com.flamingo.ai.timelineqa.domain.enums;

/** Classification of an engine failure, recorded in route traces and metrics. */
public enum ErrorKind {
  QUERY_GENERATION(false),
  INSUFFICIENT_EVIDENCE(false),
  EMBEDDING_PROVIDER(true),
  PROVIDER_TIMEOUT(true),
  GENERATION_PROVIDER(true),
  INVALID_RESULT(false),
  ENGINE_UNAVAILABLE(false),
  UNEXPECTED(false);

  private final boolean providerOutage;

  ErrorKind(boolean providerOutage) {
    this.providerOutage = providerOutage;
  }

  /** Whether this failure comes from a remote capability being down or slow. */
  public boolean isProviderOutage() {
    return providerOutage;
  }
}
