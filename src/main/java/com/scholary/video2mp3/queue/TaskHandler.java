package com.scholary.video2mp3.queue;

/** Executes a delivered task. */
@FunctionalInterface
public interface TaskHandler {

  /**
   * Process one delivery of {@code task}.
   *
   * @throws JobProcessingException when the delivery failed; the dispatcher redelivers it if the
   *     failure is retryable and attempts remain
   */
  void handle(ProcessTask task, TaskContext context);
}
