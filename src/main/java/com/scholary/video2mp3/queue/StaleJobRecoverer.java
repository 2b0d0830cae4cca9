package com.scholary.video2mp3.queue;

import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobNotFoundException;
import com.scholary.video2mp3.job.JobRepository;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.pipeline.PipelineProperties;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Finds jobs whose task was lost and puts them back on track.
 *
 * <p>Tasks live in memory, so a restart or a rejected enqueue leaves jobs without a delivery.
 * {@code queued} jobs untouched for longer than the grace period and not in flight are dispatched
 * again. {@code downloading} or {@code transcoding} jobs untouched for longer than the job timeout
 * plus grace and not in flight have lost their worker; they are marked failed so a client can
 * retry them.
 */
@Component
public class StaleJobRecoverer {

  private static final Logger LOGGER = LoggerFactory.getLogger(StaleJobRecoverer.class);

  static final int BATCH_SIZE = 100;
  static final String WORKER_LOST_MESSAGE = "worker lost: job stopped making progress";

  private final JobRepository jobs;
  private final TaskDispatcher dispatcher;
  private final PipelineProperties properties;
  private final TaskScheduler scheduler;

  public StaleJobRecoverer(
      JobRepository jobs,
      TaskDispatcher dispatcher,
      PipelineProperties properties,
      @Qualifier("taskScheduler") TaskScheduler scheduler) {
    this.jobs = jobs;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.scheduler = scheduler;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    PipelineProperties.RecoveryProperties recovery = properties.recovery();
    if (!recovery.enabled()) {
      LOGGER.info("Stale job recovery disabled");
      return;
    }
    scheduler.scheduleWithFixedDelay(this::recoverSafely, recovery.interval());
    LOGGER.info("Stale job recovery scheduled every {}", recovery.interval());
  }

  private void recoverSafely() {
    try {
      recover();
    } catch (RuntimeException e) {
      LOGGER.error("Stale job recovery failed", e);
    }
  }

  /** Run one recovery pass. */
  public RecoveryResult recover() {
    Instant now = jobs.now();
    int redispatched = redispatchQueued(now.minus(properties.recovery().queuedGrace()));
    int failed =
        failAbandoned(
            now.minus(properties.jobTimeout()).minus(properties.recovery().queuedGrace()));
    if (redispatched > 0 || failed > 0) {
      LOGGER.info("Recovered stale jobs: redispatched={}, failed={}", redispatched, failed);
    }
    return new RecoveryResult(redispatched, failed);
  }

  private int redispatchQueued(Instant updatedBefore) {
    List<Job> stale = jobs.findStale(EnumSet.of(JobStatus.QUEUED), updatedBefore, BATCH_SIZE);
    int count = 0;
    for (Job job : stale) {
      if (dispatcher.isInFlight(job.getId())) {
        continue;
      }
      try {
        dispatcher.enqueue(new ProcessTask(job.getId(), job.getSourceUrl()));
        count++;
      } catch (DispatchException e) {
        LOGGER.warn("Worker queue full, deferring recovery of remaining queued jobs");
        break;
      }
    }
    return count;
  }

  private int failAbandoned(Instant updatedBefore) {
    List<Job> stale =
        jobs.findStale(
            EnumSet.of(JobStatus.DOWNLOADING, JobStatus.TRANSCODING), updatedBefore, BATCH_SIZE);
    int count = 0;
    for (Job job : stale) {
      if (dispatcher.isInFlight(job.getId())) {
        continue;
      }
      try {
        jobs.updateStatus(job.getId(), JobStatus.FAILED, WORKER_LOST_MESSAGE, null);
        LOGGER.warn("Marked abandoned job failed: jobId={}, status={}", job.getId(), job.getStatus());
        count++;
      } catch (JobNotFoundException e) {
        LOGGER.debug("Abandoned job vanished before it could be failed: jobId={}", job.getId());
      }
    }
    return count;
  }

  /** Counts from one recovery pass. */
  public record RecoveryResult(int redispatched, int failed) {}
}
