package com.scholary.video2mp3.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Job context ({@code jobId}, {@code platform}, {@code sourceUrl}) is set for the duration of a
 * pipeline run. Each event method adds an {@code event_type} plus its own fields and removes them
 * again once the line is written.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a persisted status change. */
  public void logStageTransition(String jobId, String from, String to) {
    try {
      MDC.put("event_type", "stage_transition");
      MDC.put("fromStatus", from);
      MDC.put("toStatus", to);

      logger.info("Stage transition: jobId={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a download attempt that will be retried. */
  public void logFetchRetry(String url, int attempt, int maxAttempts, String message) {
    try {
      MDC.put("event_type", "fetch_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.warn(
          "Fetch retry: url={}, attempt={}/{}, error={}", url, attempt, maxAttempts, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job failure that was persisted. */
  public void logJobFailed(String jobId, String stage, boolean retryable, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("stage", stage);
      MDC.put("retryable", String.valueOf(retryable));

      logger.error(
          "Job failed: jobId={}, stage={}, retryable={}, error={}",
          jobId,
          stage,
          retryable,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job that reached ready. */
  public void logJobCompleted(String jobId, String resultRef, long elapsedMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("resultRef", resultRef);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Job completed: jobId={}, key={}, elapsed={}ms", jobId, resultRef, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a task scheduled for another delivery. */
  public void logTaskRedelivery(String jobId, int nextAttempt, int maxAttempts, long delayMs) {
    try {
      MDC.put("event_type", "task_redelivery");
      MDC.put("attempt", String.valueOf(nextAttempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.warn(
          "Task redelivery: jobId={}, attempt={}/{}, delay={}ms",
          jobId,
          nextAttempt,
          maxAttempts,
          delayMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String platform, String sourceUrl) {
    MDC.put("jobId", jobId);
    if (platform != null) {
      MDC.put("platform", platform);
    }
    if (sourceUrl != null) {
      MDC.put("sourceUrl", sourceUrl);
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("platform");
    MDC.remove("sourceUrl");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("stage");
    MDC.remove("retryable");
    MDC.remove("resultRef");
    MDC.remove("elapsedMs");
  }
}
