package com.scholary.video2mp3.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window request counter per client, held in a Caffeine cache.
 *
 * <p>A client's window opens with its first request and lasts {@code window}. Up to {@code limit}
 * requests are admitted in it; the rest are rejected with the time left until it resets. Each
 * entry expires when its window ends, and expired entries are swept at most once per window.
 *
 * <p>At most {@code maxClients} windows are tracked. Once that many distinct clients are live,
 * Caffeine evicts windows that are still open, and an evicted client starts over with a fresh
 * window and a full allowance. Memory stays bounded under a flood of distinct keys at the cost of
 * limiting some clients loosely while it lasts.
 *
 * <p>State is per process. Counts are not shared between instances.
 */
public class FixedWindowRateLimiter implements RateLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

  private final int limit;
  private final Duration window;
  private final Clock clock;
  private final Cache<String, Window> windows;
  private final AtomicReference<Instant> lastCleanup;

  public FixedWindowRateLimiter(int limit, Duration window, long maxClients, Clock clock) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, got " + limit);
    }
    this.limit = limit;
    this.window = window;
    this.clock = clock;
    this.lastCleanup = new AtomicReference<>(clock.instant());
    this.windows =
        Caffeine.newBuilder()
            .maximumSize(maxClients)
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfter(new WindowExpiry(clock))
            .build();

    LOGGER.info(
        "Initialized rate limiter: limit={}, window={}, maxClients={}", limit, window, maxClients);
  }

  @Override
  public RateLimitDecision allow(String key) {
    Instant now = clock.instant();
    RateLimitDecision[] decision = new RateLimitDecision[1];

    windows
        .asMap()
        .compute(
            key,
            (k, current) -> {
              Window active =
                  current == null || !now.isBefore(current.resetAt())
                      ? new Window(0, now.plus(window))
                      : current;
              if (active.count() < limit) {
                Window next = new Window(active.count() + 1, active.resetAt());
                decision[0] = RateLimitDecision.allow(limit - next.count());
                return next;
              }
              decision[0] = RateLimitDecision.reject(Duration.between(now, active.resetAt()));
              return active;
            });

    cleanUpIfDue(now);
    if (!decision[0].allowed()) {
      LOGGER.debug("Rate limited: key={}, retryAfter={}", key, decision[0].retryAfter());
    }
    return decision[0];
  }

  @Override
  public int limit() {
    return limit;
  }

  long trackedClients() {
    windows.cleanUp();
    return windows.estimatedSize();
  }

  private void cleanUpIfDue(Instant now) {
    Instant last = lastCleanup.get();
    if (Duration.between(last, now).compareTo(window) >= 0 && lastCleanup.compareAndSet(last, now)) {
      windows.cleanUp();
    }
  }

  private record Window(int count, Instant resetAt) {}

  /** Expires each entry at its window's reset time. */
  private static final class WindowExpiry implements Expiry<String, Window> {

    private final Clock clock;

    WindowExpiry(Clock clock) {
      this.clock = clock;
    }

    @Override
    public long expireAfterCreate(String key, Window value, long currentTime) {
      return nanosUntil(value.resetAt());
    }

    @Override
    public long expireAfterUpdate(
        String key, Window value, long currentTime, long currentDuration) {
      return nanosUntil(value.resetAt());
    }

    @Override
    public long expireAfterRead(String key, Window value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long nanosUntil(Instant resetAt) {
      return Math.max(0, Duration.between(clock.instant(), resetAt).toNanos());
    }
  }
}
