package com.scholary.video2mp3.retention;

import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobNotFoundException;
import com.scholary.video2mp3.job.JobRepository;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.objectstore.ObjectStoreClient;
import com.scholary.video2mp3.objectstore.ObjectStoreException;
import com.scholary.video2mp3.objectstore.ResultRefs;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes old jobs and their audio.
 *
 * <p>{@link #sweep} pages through jobs created before the cutoff, deletes each one's object
 * (failures are logged and skipped), then deletes the rows in one statement. Rows created at or
 * after the cutoff are never touched. Foreign absolute result URLs are left alone.
 *
 * <p>{@link #expire} is a separate, optional phase that moves ready jobs to {@code expired} and
 * deletes their object while keeping the row.
 */
@Component
public class RetentionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);

  static final int PAGE_SIZE = 200;

  private final JobRepository jobs;
  private final ObjectStoreClient objectStore;
  private final ResultRefs resultRefs;

  public RetentionSweeper(
      JobRepository jobs, ObjectStoreClient objectStore, ResultRefs resultRefs) {
    this.jobs = jobs;
    this.objectStore = objectStore;
    this.resultRefs = resultRefs;
  }

  public SweepResult sweep(Instant cutoff) {
    LOGGER.info("Retention sweep started: cutoff={}", cutoff);
    int blobsDeleted = 0;
    int page = 0;
    while (true) {
      List<Job> batch = jobs.listBefore(cutoff, page, PAGE_SIZE);
      for (Job job : batch) {
        if (deleteBlob(job)) {
          blobsDeleted++;
        }
      }
      if (batch.size() < PAGE_SIZE) {
        break;
      }
      page++;
    }
    long rowsDeleted = jobs.deleteBefore(cutoff);
    LOGGER.info(
        "Retention sweep finished: cutoff={}, rowsDeleted={}, blobsDeleted={}",
        cutoff,
        rowsDeleted,
        blobsDeleted);
    return new SweepResult(rowsDeleted, blobsDeleted);
  }

  /** Expire ready jobs last updated before {@code cutoff}. Returns how many were expired. */
  public int expire(Instant cutoff) {
    int expired = 0;
    while (true) {
      List<Job> batch = jobs.findStale(EnumSet.of(JobStatus.READY), cutoff, PAGE_SIZE);
      for (Job job : batch) {
        deleteBlob(job);
        try {
          jobs.updateStatus(job.getId(), JobStatus.EXPIRED);
          expired++;
        } catch (JobNotFoundException e) {
          LOGGER.debug("Job deleted before it could expire: jobId={}", job.getId());
        }
      }
      if (batch.size() < PAGE_SIZE) {
        break;
      }
    }
    if (expired > 0) {
      LOGGER.info("Expired {} ready jobs last updated before {}", expired, cutoff);
    }
    return expired;
  }

  private boolean deleteBlob(Job job) {
    Optional<String> key = resultRefs.objectKey(job.getResultRef());
    if (key.isEmpty()) {
      return false;
    }
    try {
      objectStore.delete(key.get());
      return true;
    } catch (ObjectStoreException e) {
      LOGGER.warn("Failed to delete object for job {}: {}", job.getId(), e.getMessage());
      return false;
    }
  }
}
