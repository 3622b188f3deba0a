package com.flamingo.ai.timelineqa.exception;

import com.flamingo.ai.timelineqa.service.router.RouteTrace;

/** Exception thrown when every applicable answer engine has been exhausted. */
public class QueryFailedException extends RuntimeException {

  private final RouteTrace trace;

  public QueryFailedException(RouteTrace trace) {
    super("No engine could answer the question: " + trace.getQuestion());
    this.trace = trace;
  }

  public RouteTrace getTrace() {
    return trace;
  }

  public String getUserMessage() {
    return "I couldn't find enough information in your timeline to answer that question.";
  }
}
