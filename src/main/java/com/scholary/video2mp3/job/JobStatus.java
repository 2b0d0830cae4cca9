package com.scholary.video2mp3.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a conversion job.
 *
 * <p>The success path is {@code queued -> downloading -> transcoding -> ready}. Any active state may
 * fall into {@code failed}. {@code ready} may be moved to {@code expired} by the retention sweeper,
 * and only {@code failed} or {@code expired} jobs may be re-queued by an explicit retry.
 */
public enum JobStatus {
  QUEUED("queued"),
  DOWNLOADING("downloading"),
  TRANSCODING("transcoding"),
  READY("ready"),
  FAILED("failed"),
  EXPIRED("expired");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Terminal states end live status streams and are never left without an explicit action. */
  public boolean isTerminal() {
    return this == READY || this == FAILED || this == EXPIRED;
  }

  public boolean isActive() {
    return !isTerminal();
  }

  /** Whether a client may re-enqueue a job in this state. */
  public boolean isRetryable() {
    return this == FAILED || this == EXPIRED;
  }

  public boolean canTransitionTo(JobStatus next) {
    return allowedNext().contains(next);
  }

  private Set<JobStatus> allowedNext() {
    switch (this) {
      case QUEUED:
        return EnumSet.of(DOWNLOADING, FAILED);
      case DOWNLOADING:
        return EnumSet.of(TRANSCODING, FAILED);
      case TRANSCODING:
        return EnumSet.of(READY, FAILED);
      case READY:
        return EnumSet.of(EXPIRED);
      default:
        return EnumSet.of(QUEUED);
    }
  }

  public static JobStatus fromValue(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("Job status is null");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (JobStatus status : values()) {
      if (status.value.equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + raw);
  }
}
