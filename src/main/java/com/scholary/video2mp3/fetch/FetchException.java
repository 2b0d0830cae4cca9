package com.scholary.video2mp3.fetch;

/** A download failed. {@link #isRetryable()} tells whether another attempt may succeed. */
public class FetchException extends RuntimeException {

  private final boolean retryable;

  public FetchException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public FetchException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
