package com.flamingo.ai.timelineqa.exception;

/**
 * Exception raised by the structured query engine for any failure to produce an answer. Only the
 * query router catches it; it never reaches API callers.
 */
public class QueryGenerationException extends RuntimeException {

  /** Why the structured path gave up. */
  public enum Reason {
    NO_VIEWS,
    GENERATION_FAILED,
    NOT_ANSWERABLE,
    VALIDATION_REJECTED,
    EXECUTION_FAILED
  }

  private final Reason reason;

  public QueryGenerationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public QueryGenerationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
