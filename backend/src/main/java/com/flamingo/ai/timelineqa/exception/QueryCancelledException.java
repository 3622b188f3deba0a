package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when the caller abandons a question while an engine is still working. */
public class QueryCancelledException extends RuntimeException {

  public QueryCancelledException(String question, Throwable cause) {
    super("Query cancelled: " + question, cause);
  }
}
