package com.flamingo.ai.timelineqa.domain.enums;

/** How two episodes are considered related. */
public enum RelationType {
  /** Nearest neighbors in embedding space. */
  SEMANTIC,

  /** Closest in time, regardless of content. */
  TEMPORAL
}
