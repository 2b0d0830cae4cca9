package com.scholary.video2mp3.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Delivery metadata handed to a {@link TaskHandler}.
 *
 * @param attempt 1-based delivery number
 * @param maxAttempts deliveries allowed in total
 * @param deadline instant after which the delivery is aborted
 */
public record TaskContext(String jobId, int attempt, int maxAttempts, Instant deadline) {

  public boolean isLastAttempt() {
    return attempt >= maxAttempts;
  }

  /** Time left until the deadline; zero or negative once it has passed. */
  public Duration remaining(Clock clock) {
    return Duration.between(clock.instant(), deadline);
  }
}
