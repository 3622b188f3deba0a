package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when the embedding capability is unavailable or returns unusable vectors. */
public class EmbeddingProviderException extends RuntimeException {

  private final String userMessage;

  public EmbeddingProviderException(String message) {
    super(message);
    this.userMessage = "Semantic search is temporarily unavailable. Please try again later.";
  }

  public EmbeddingProviderException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Semantic search is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
