package com.scholary.video2mp3.config;

import com.scholary.video2mp3.events.StreamProperties;
import com.scholary.video2mp3.pipeline.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for background execution.
 *
 * <p>The worker pool runs pipeline tasks; its size is the number of jobs converted concurrently.
 * {@code taskScheduler} drives redelivery backoff, job watchdogs and the periodic sweeps. Status
 * streams block on store reads and client sockets, so they run on {@code streamTaskScheduler} and
 * cannot hold up a watchdog.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "workerTaskExecutor")
  public ThreadPoolTaskExecutor workerTaskExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "taskScheduler")
  public TaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(4);
    scheduler.setThreadNamePrefix("scheduler-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }

  @Bean(name = "streamTaskScheduler")
  public TaskScheduler streamTaskScheduler(StreamProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.schedulerThreads());
    scheduler.setThreadNamePrefix("stream-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
