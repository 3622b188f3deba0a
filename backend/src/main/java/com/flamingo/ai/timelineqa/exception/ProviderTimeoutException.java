package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when a remote capability does not answer within its time budget. */
public class ProviderTimeoutException extends RuntimeException {

  private final String provider;

  public ProviderTimeoutException(String provider, String message) {
    super(message);
    this.provider = provider;
  }

  public ProviderTimeoutException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
