package com.flamingo.ai.timelineqa.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.timelineqa.service.router.RouteTrace;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String QUERY_FAILED = "QA_001";
  public static final String QUERY_CANCELLED = "QA_002";
  public static final String EPISODE_NOT_FOUND = "EPISODE_001";
  public static final String MALFORMED_RECORD = "EPISODE_002";
  public static final String EMBEDDING_UNAVAILABLE = "INDEX_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String PROVIDER_TIMEOUT = "LLM_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;

  /** Routing trace of a question that no engine could answer. */
  private final RouteTrace trace;
}
