package com.flamingo.ai.timelineqa.domain.enums;

/** States of the query routing state machine. */
public enum RouterState {
  CLASSIFY,
  TRY_STRUCTURED,
  TRY_RETRIEVAL,
  TRY_GENERAL,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
