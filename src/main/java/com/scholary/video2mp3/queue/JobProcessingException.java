package com.scholary.video2mp3.queue;

/**
 * A task delivery failed after its failure was recorded on the job.
 *
 * <p>{@link #isRetryable()} tells the dispatcher whether another delivery may succeed.
 */
public class JobProcessingException extends RuntimeException {

  private final boolean retryable;

  public JobProcessingException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
