package com.scholary.video2mp3.service;

import com.scholary.video2mp3.api.JobResponse;
import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobConflictException;
import com.scholary.video2mp3.job.JobRepository;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.objectstore.ObjectStoreClient;
import com.scholary.video2mp3.objectstore.ObjectStoreProperties;
import com.scholary.video2mp3.objectstore.ResultRefs;
import com.scholary.video2mp3.platform.InvalidSourceUrlException;
import com.scholary.video2mp3.platform.Platform;
import com.scholary.video2mp3.platform.PlatformDetector;
import com.scholary.video2mp3.platform.SourceUrlExtractor;
import com.scholary.video2mp3.queue.DispatchException;
import com.scholary.video2mp3.queue.ProcessTask;
import com.scholary.video2mp3.queue.TaskDispatcher;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Job lifecycle operations behind the HTTP API.
 *
 * <p>Creation and retry write the job first and dispatch second. A dispatch that fails leaves the
 * job {@code queued}; the stale-job recoverer dispatches it later, so the request still succeeds.
 *
 * <p>Result URLs are never stored. Every snapshot signs the stored key again.
 */
@Service
public class JobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);

  private final JobRepository jobs;
  private final TaskDispatcher dispatcher;
  private final SourceUrlExtractor urlExtractor;
  private final PlatformDetector platformDetector;
  private final ObjectStoreClient objectStore;
  private final ObjectStoreProperties objectStoreProperties;
  private final ResultRefs resultRefs;

  public JobService(
      JobRepository jobs,
      TaskDispatcher dispatcher,
      SourceUrlExtractor urlExtractor,
      PlatformDetector platformDetector,
      ObjectStoreClient objectStore,
      ObjectStoreProperties objectStoreProperties,
      ResultRefs resultRefs) {
    this.jobs = jobs;
    this.dispatcher = dispatcher;
    this.urlExtractor = urlExtractor;
    this.platformDetector = platformDetector;
    this.objectStore = objectStore;
    this.objectStoreProperties = objectStoreProperties;
    this.resultRefs = resultRefs;
  }

  /**
   * Create a job for the first link in {@code input} and dispatch it.
   *
   * @throws InvalidSourceUrlException if there is no link or its platform is unsupported
   */
  public Job create(String input) {
    String sourceUrl =
        urlExtractor
            .extract(input)
            .orElseThrow(() -> new InvalidSourceUrlException("no valid url found"));
    Platform platform =
        platformDetector
            .detect(sourceUrl)
            .orElseThrow(() -> new InvalidSourceUrlException("unsupported platform"));

    Job job =
        jobs.create(
            new Job(UUID.randomUUID().toString(), sourceUrl, platform.tag(), jobs.now()));
    LOGGER.info(
        "Job created: jobId={}, platform={}, sourceUrl={}",
        job.getId(),
        job.getPlatform(),
        sourceUrl);
    dispatch(job);
    return job;
  }

  public Job get(String id) {
    return jobs.get(id);
  }

  public List<Job> list(int limit) {
    return jobs.list(limit);
  }

  /**
   * Re-queue a failed or expired job.
   *
   * <p>A failed job may still have a redelivery pending from its last run; it is only re-queued
   * once that task chain has ended.
   *
   * @throws JobConflictException if the job is in any other state, still has a delivery pending,
   *     or was re-queued by a concurrent call
   */
  public Job retry(String id) {
    Job job = jobs.get(id);
    JobStatus previous = job.getStatus();
    if (!previous.isRetryable()) {
      throw new JobConflictException("job not retryable in status " + previous.value());
    }
    if (dispatcher.isInFlight(id)) {
      throw new JobConflictException("job still has a delivery pending");
    }
    if (!jobs.requeue(id)) {
      throw new JobConflictException("job was re-queued concurrently");
    }
    LOGGER.info("Job re-queued: jobId={}, previousStatus={}", id, previous.value());
    Job queued = jobs.get(id);
    dispatch(queued);
    return queued;
  }

  /** Client view of {@code job}, with a freshly signed URL when it is ready. */
  public JobResponse toResponse(Job job) {
    return JobResponse.from(job, resultUrl(job).orElse(null));
  }

  /**
   * Signed download URL for a ready job, asking the store to serve it as an attachment.
   *
   * @throws JobConflictException if the job is not ready
   * @throws ResultNotFoundException if the ready job has no result reference
   */
  public String downloadUrl(String id) {
    Job job = jobs.get(id);
    if (job.getStatus() != JobStatus.READY) {
      throw new JobConflictException("job not ready");
    }
    return signedUrl(job, ResultRefs.downloadFilename(job.getId()))
        .orElseThrow(() -> new ResultNotFoundException(id));
  }

  private Optional<String> resultUrl(Job job) {
    if (job.getStatus() != JobStatus.READY) {
      return Optional.empty();
    }
    return signedUrl(job, null);
  }

  private Optional<String> signedUrl(Job job, String filename) {
    String ref = job.getResultRef();
    Optional<String> key = resultRefs.objectKey(ref);
    if (key.isPresent()) {
      return Optional.of(
          objectStore.presignRead(key.get(), objectStoreProperties.urlTtl(), filename).toString());
    }
    // foreign absolute URLs are handed out as stored
    if (ResultRefs.isAbsoluteUrl(ref)) {
      return Optional.of(ref.trim());
    }
    return Optional.empty();
  }

  private void dispatch(Job job) {
    try {
      dispatcher.enqueue(new ProcessTask(job.getId(), job.getSourceUrl()));
    } catch (DispatchException e) {
      LOGGER.warn(
          "Dispatch failed, job stays queued for recovery: jobId={}, error={}",
          job.getId(),
          e.getMessage());
    }
  }
}
