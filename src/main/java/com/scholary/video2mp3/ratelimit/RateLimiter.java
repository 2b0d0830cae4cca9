package com.scholary.video2mp3.ratelimit;

/** Admission control keyed by client identity. */
public interface RateLimiter {

  /** Count a request for {@code key} and say whether it may proceed. */
  RateLimitDecision allow(String key);

  /** Requests allowed per window. */
  int limit();
}
