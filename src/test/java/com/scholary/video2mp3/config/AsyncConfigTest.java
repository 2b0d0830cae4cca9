package com.scholary.video2mp3.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.video2mp3.events.StreamProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class AsyncConfigTest {

  private final AsyncConfig config = new AsyncConfig();

  private TaskScheduler pipelineScheduler;
  private TaskScheduler streamScheduler;

  @AfterEach
  void tearDown() {
    if (pipelineScheduler != null) {
      ((ThreadPoolTaskScheduler) pipelineScheduler).shutdown();
    }
    if (streamScheduler != null) {
      ((ThreadPoolTaskScheduler) streamScheduler).shutdown();
    }
  }

  @Test
  void streamScheduler_shouldBeSizedFromStreamProperties() {
    streamScheduler = config.streamTaskScheduler(properties(3));

    ThreadPoolTaskScheduler scheduler = (ThreadPoolTaskScheduler) streamScheduler;
    assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(3);
    assertThat(scheduler.getThreadNamePrefix()).isEqualTo("stream-");
  }

  @Test
  void watchdog_shouldFireWhileEveryStreamThreadIsStalled() throws Exception {
    pipelineScheduler = config.taskScheduler();
    streamScheduler = config.streamTaskScheduler(properties(2));
    CountDownLatch stalled = new CountDownLatch(2);
    CountDownLatch unblock = new CountDownLatch(1);
    for (int i = 0; i < 2; i++) {
      streamScheduler.schedule(
          () -> {
            stalled.countDown();
            try {
              unblock.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          },
          Instant.now());
    }
    assertThat(stalled.await(2, TimeUnit.SECONDS)).isTrue();

    CountDownLatch watchdog = new CountDownLatch(1);
    pipelineScheduler.schedule(watchdog::countDown, Instant.now().plusMillis(50));

    assertThat(watchdog.await(2, TimeUnit.SECONDS)).isTrue();
    unblock.countDown();
  }

  private static StreamProperties properties(int threads) {
    return new StreamProperties(
        Duration.ofSeconds(3), Duration.ofSeconds(15), Duration.ofMinutes(30), threads);
  }
}
