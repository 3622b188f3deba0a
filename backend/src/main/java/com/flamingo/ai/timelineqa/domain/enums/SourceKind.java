package com.flamingo.ai.timelineqa.domain.enums;

/** What a cited answer source points to. */
public enum SourceKind {
  EPISODE,
  STRUCTURED_VIEW
}
