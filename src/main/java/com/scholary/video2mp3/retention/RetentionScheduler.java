package com.scholary.video2mp3.retention;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** Runs the retention sweep, and the expiry phase when configured, on a fixed delay. */
@Component
public class RetentionScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionScheduler.class);

  private final RetentionSweeper sweeper;
  private final RetentionProperties properties;
  private final TaskScheduler scheduler;
  private final Clock clock;

  public RetentionScheduler(
      RetentionSweeper sweeper,
      RetentionProperties properties,
      @Qualifier("taskScheduler") TaskScheduler scheduler,
      Clock clock) {
    this.sweeper = sweeper;
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    if (!properties.periodicCleanupEnabled() && !properties.expiryEnabled()) {
      LOGGER.info("Periodic retention disabled");
      return;
    }
    scheduler.scheduleWithFixedDelay(
        this::runSafely,
        clock.instant().plus(properties.cleanupInterval()),
        properties.cleanupInterval());
    LOGGER.info(
        "Periodic retention scheduled: interval={}, days={}, expireReadyAfter={}",
        properties.cleanupInterval(),
        properties.days(),
        properties.expireReadyAfter());
  }

  void runSafely() {
    try {
      runOnce();
    } catch (RuntimeException e) {
      LOGGER.error("Periodic retention failed", e);
    }
  }

  void runOnce() {
    Instant now = clock.instant();
    if (properties.expiryEnabled()) {
      sweeper.expire(now.minus(properties.expireReadyAfter()));
    }
    if (properties.periodicCleanupEnabled()) {
      sweeper.sweep(now.minus(Duration.ofDays(properties.days())));
    }
  }
}
