package com.scholary.video2mp3.api;

import com.scholary.video2mp3.job.JobStatus;

/** Returned when a job is created or re-queued. */
public record CreateJobResponse(String jobId, JobStatus status) {}
