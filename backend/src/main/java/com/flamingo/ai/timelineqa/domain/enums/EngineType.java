package com.flamingo.ai.timelineqa.domain.enums;

/** Answer engines the query router can dispatch to. */
public enum EngineType {
  STRUCTURED,
  RETRIEVAL,
  GENERAL_KNOWLEDGE
}
