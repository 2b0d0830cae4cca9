package com.scholary.video2mp3.ratelimit;

import java.time.Duration;

/**
 * Outcome of a rate-limit check.
 *
 * @param remaining requests left in the current window
 * @param retryAfter time until the window resets; zero when the request was allowed
 */
public record RateLimitDecision(boolean allowed, int remaining, Duration retryAfter) {

  static RateLimitDecision allow(int remaining) {
    return new RateLimitDecision(true, remaining, Duration.ZERO);
  }

  static RateLimitDecision reject(Duration retryAfter) {
    return new RateLimitDecision(false, 0, retryAfter);
  }

  /** Whole seconds to wait, rounded and never below one. */
  public long retryAfterSeconds() {
    return Math.max(1, Math.round(retryAfter.toMillis() / 1000.0));
  }
}
