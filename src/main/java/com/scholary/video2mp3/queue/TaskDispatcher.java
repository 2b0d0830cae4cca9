package com.scholary.video2mp3.queue;

/**
 * Hands tasks to background workers.
 *
 * <p>Delivery is at least once: a task may run more than once, concurrently with a retry of the
 * same job, and handlers must converge on a terminal status regardless.
 */
public interface TaskDispatcher {

  /**
   * Schedule {@code task} for asynchronous execution.
   *
   * @throws DispatchException if no worker capacity is available
   */
  void enqueue(ProcessTask task);

  /** Whether a delivery for {@code jobId} is queued, running or waiting for redelivery. */
  boolean isInFlight(String jobId);
}
