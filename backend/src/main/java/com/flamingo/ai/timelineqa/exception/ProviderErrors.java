package com.flamingo.ai.timelineqa.exception;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/** Maps raw failures of the generation capability onto the typed provider exceptions. */
public final class ProviderErrors {

  private ProviderErrors() {}

  /**
   * Returns a {@link ProviderTimeoutException} when the failure is a timeout, otherwise an {@link
   * LlmServiceException}. Already typed provider exceptions pass through unchanged.
   */
  public static RuntimeException generationFailure(String operation, RuntimeException e) {
    if (e instanceof LlmServiceException
        || e instanceof ProviderTimeoutException
        || e instanceof GenerationFormatException) {
      return e;
    }
    if (isTimeout(e)) {
      return new ProviderTimeoutException("generation", operation + " timed out", e);
    }
    return new LlmServiceException(operation + " failed: " + e.getMessage(), e);
  }

  static boolean isTimeout(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof SocketTimeoutException
          || t instanceof HttpTimeoutException
          || t instanceof TimeoutException) {
        return true;
      }
      String message = t.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains("timed out")) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }
}
