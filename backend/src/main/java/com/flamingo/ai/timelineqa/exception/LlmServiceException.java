package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when the generation capability fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message) {
    super(message);
    this.rateLimited = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = isRateLimit(cause);
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static boolean isRateLimit(Throwable cause) {
    String message = cause != null ? cause.getMessage() : null;
    return message != null && (message.contains("429") || message.contains("rate limit"));
  }
}
