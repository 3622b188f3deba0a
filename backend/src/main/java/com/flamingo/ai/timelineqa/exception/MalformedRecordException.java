package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when a source record cannot be verbalized into an episode. */
public class MalformedRecordException extends RuntimeException {

  private final String field;

  public MalformedRecordException(String message) {
    super(message);
    this.field = null;
  }

  public MalformedRecordException(String message, String field) {
    super(message);
    this.field = field;
  }

  public MalformedRecordException(String message, String field, Throwable cause) {
    super(message, cause);
    this.field = field;
  }

  /** Name of the offending field, or {@code null} when the record as a whole is invalid. */
  public String getField() {
    return field;
  }
}
