package com.scholary.video2mp3.queue;

import com.scholary.video2mp3.logging.StructuredLogger;
import com.scholary.video2mp3.pipeline.PipelineProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * In-process dispatcher on top of the worker thread pool.
 *
 * <p>Every delivery runs under a watchdog that interrupts the worker thread at the job deadline.
 * A retryable failure is redelivered after {@code retryBackoff × attempt} until {@code maxRetries}
 * redeliveries have been used; anything else ends the task. Tasks lost with the process are picked
 * up again by {@link StaleJobRecoverer}, which is what makes delivery at least once.
 */
@Component
public class ExecutorTaskDispatcher implements TaskDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTaskDispatcher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ThreadPoolTaskExecutor executor;
  private final TaskScheduler scheduler;
  private final TaskHandler handler;
  private final PipelineProperties properties;
  private final Clock clock;

  // jobId -> number of task chains currently alive for it
  private final Map<String, Integer> inFlight = new ConcurrentHashMap<>();

  public ExecutorTaskDispatcher(
      @Qualifier("workerTaskExecutor") ThreadPoolTaskExecutor executor,
      @Qualifier("taskScheduler") TaskScheduler scheduler,
      TaskHandler handler,
      PipelineProperties properties,
      Clock clock) {
    this.executor = executor;
    this.scheduler = scheduler;
    this.handler = handler;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void enqueue(ProcessTask task) {
    acquire(task.jobId());
    try {
      submit(task, 1);
    } catch (DispatchException e) {
      release(task.jobId());
      throw e;
    }
    LOGGER.debug("Enqueued task: jobId={}", task.jobId());
  }

  @Override
  public boolean isInFlight(String jobId) {
    return inFlight.containsKey(jobId);
  }

  private void submit(ProcessTask task, int attempt) {
    try {
      executor.execute(() -> run(task, attempt));
    } catch (TaskRejectedException e) {
      throw new DispatchException("Worker queue rejected job " + task.jobId(), e);
    }
  }

  private void run(ProcessTask task, int attempt) {
    int maxAttempts = properties.maxAttempts();
    Instant deadline = clock.instant().plus(properties.jobTimeout());
    Thread worker = Thread.currentThread();
    ScheduledFuture<?> watchdog =
        scheduler.schedule(
            () -> {
              LOGGER.warn(
                  "Job deadline reached, interrupting worker: jobId={}, attempt={}",
                  task.jobId(),
                  attempt);
              worker.interrupt();
            },
            deadline);

    boolean redelivering = false;
    try {
      handler.handle(task, new TaskContext(task.jobId(), attempt, maxAttempts, deadline));
    } catch (JobProcessingException e) {
      redelivering = handleFailure(task, attempt, maxAttempts, e.isRetryable(), e);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected task failure: jobId={}, attempt={}", task.jobId(), attempt, e);
      redelivering = handleFailure(task, attempt, maxAttempts, true, e);
    } finally {
      watchdog.cancel(false);
      // a watchdog that fired after the handler returned must not leak into the next task
      Thread.interrupted();
      if (!redelivering) {
        release(task.jobId());
      }
    }
  }

  private boolean handleFailure(
      ProcessTask task, int attempt, int maxAttempts, boolean retryable, RuntimeException e) {
    if (!retryable) {
      LOGGER.warn("Task failed permanently: jobId={}, error={}", task.jobId(), e.getMessage());
      return false;
    }
    if (attempt >= maxAttempts) {
      LOGGER.error(
          "Task exhausted {} attempts: jobId={}, error={}",
          maxAttempts,
          task.jobId(),
          e.getMessage());
      return false;
    }

    int nextAttempt = attempt + 1;
    Duration delay = properties.retryBackoff().multipliedBy(attempt);
    STRUCTURED_LOGGER.logTaskRedelivery(task.jobId(), nextAttempt, maxAttempts, delay.toMillis());
    try {
      scheduler.schedule(() -> redeliver(task, nextAttempt), clock.instant().plus(delay));
      return true;
    } catch (RuntimeException scheduleFailure) {
      LOGGER.error("Failed to schedule redelivery: jobId={}", task.jobId(), scheduleFailure);
      return false;
    }
  }

  private void redeliver(ProcessTask task, int attempt) {
    try {
      submit(task, attempt);
    } catch (DispatchException e) {
      LOGGER.error("Redelivery rejected: jobId={}, attempt={}", task.jobId(), attempt, e);
      release(task.jobId());
    }
  }

  private void acquire(String jobId) {
    inFlight.merge(jobId, 1, Integer::sum);
  }

  private void release(String jobId) {
    inFlight.computeIfPresent(jobId, (id, count) -> count > 1 ? count - 1 : null);
  }
}
