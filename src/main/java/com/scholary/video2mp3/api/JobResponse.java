package com.scholary.video2mp3.api;

import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobStatus;
import java.time.Instant;

/**
 * Snapshot of a job as clients see it.
 *
 * <p>{@code mp3Url} is a freshly signed read URL, present only when the job is ready.
 */
public record JobResponse(
    String jobId,
    String sourceUrl,
    String platform,
    JobStatus status,
    String error,
    String mp3Url,
    Instant createdAt,
    Instant updatedAt) {

  public static JobResponse from(Job job, String mp3Url) {
    return new JobResponse(
        job.getId(),
        job.getSourceUrl(),
        job.getPlatform(),
        job.getStatus(),
        job.getError(),
        mp3Url,
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
