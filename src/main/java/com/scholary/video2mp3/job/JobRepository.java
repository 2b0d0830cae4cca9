package com.scholary.video2mp3.job;

import jakarta.persistence.EntityExistsException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable store for conversion jobs.
 *
 * <p>This is the single source of truth for job state. Every write is a single-row statement: jobs
 * are inserted once and afterwards only the status fields are rewritten, so a status update can never
 * clobber the immutable columns.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  public static final int DEFAULT_LIST_LIMIT = 20;
  public static final int MAX_LIST_LIMIT = 100;

  private static final Set<JobStatus> RETRYABLE = EnumSet.of(JobStatus.FAILED, JobStatus.EXPIRED);

  private final JobJpaRepository jobs;
  private final EntityManager entityManager;
  private final Clock clock;

  public JobRepository(JobJpaRepository jobs, EntityManager entityManager, Clock clock) {
    this.jobs = jobs;
    this.entityManager = entityManager;
    this.clock = clock;
  }

  /**
   * Insert a new job.
   *
   * @throws JobConflictException if a job with the same id already exists
   */
  @Transactional
  public Job create(Job job) {
    if (jobs.existsById(job.getId())) {
      throw new JobConflictException("Job already exists: " + job.getId());
    }
    try {
      entityManager.persist(job);
      entityManager.flush();
    } catch (EntityExistsException e) {
      throw new JobConflictException("Job already exists: " + job.getId());
    } catch (PersistenceException e) {
      if (isConstraintViolation(e)) {
        throw new JobConflictException("Job already exists: " + job.getId());
      }
      throw e;
    }
    LOGGER.debug("Created job: id={}, platform={}", job.getId(), job.getPlatform());
    return job;
  }

  /**
   * Load a job by id.
   *
   * @throws JobNotFoundException if no such job exists
   */
  @Transactional(readOnly = true)
  public Job get(String id) {
    return jobs.findById(id).orElseThrow(() -> new JobNotFoundException(id));
  }

  /** Most recent jobs first. Non-positive limits fall back to 20; anything above 100 is capped. */
  @Transactional(readOnly = true)
  public List<Job> list(int limit) {
    return jobs.findAllByOrderByCreatedAtDesc(PageRequest.of(0, clampLimit(limit)));
  }

  /** Oldest-first page of jobs created strictly before {@code cutoff}. */
  @Transactional(readOnly = true)
  public List<Job> listBefore(Instant cutoff, int page, int pageSize) {
    return jobs.findByCreatedAtBeforeOrderByCreatedAtAscIdAsc(
        cutoff, PageRequest.of(page, pageSize));
  }

  /** Delete every job created strictly before {@code cutoff} and return how many went. */
  @Transactional
  public long deleteBefore(Instant cutoff) {
    int deleted = jobs.deleteCreatedBefore(cutoff);
    LOGGER.info("Deleted {} jobs created before {}", deleted, cutoff);
    return deleted;
  }

  /** Jobs in one of {@code statuses} whose last update is older than {@code updatedBefore}. */
  @Transactional(readOnly = true)
  public List<Job> findStale(Collection<JobStatus> statuses, Instant updatedBefore, int limit) {
    return jobs.findByStatusInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
        statuses, updatedBefore, PageRequest.of(0, limit));
  }

  /**
   * Overwrite a job's status, error and result reference and refresh {@code updatedAt}.
   *
   * <p>{@code error} may only accompany {@link JobStatus#FAILED} and {@code resultRef} only {@link
   * JobStatus#READY}; both are cleared for every other status.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  @Transactional
  public void updateStatus(String id, JobStatus status, String error, String resultRef) {
    if (error != null && status != JobStatus.FAILED) {
      throw new IllegalArgumentException("error is only valid for failed jobs, got " + status);
    }
    if (resultRef != null && status != JobStatus.READY) {
      throw new IllegalArgumentException("resultRef is only valid for ready jobs, got " + status);
    }
    if (status == JobStatus.READY && (resultRef == null || resultRef.isBlank())) {
      throw new IllegalArgumentException("ready jobs require a resultRef");
    }
    if (status == JobStatus.FAILED && (error == null || error.isBlank())) {
      throw new IllegalArgumentException("failed jobs require an error message");
    }
    int updated = jobs.updateStatus(id, status, error, resultRef, now());
    if (updated == 0) {
      throw new JobNotFoundException(id);
    }
    LOGGER.debug("Updated job status: id={}, status={}", id, status.value());
  }

  @Transactional
  public void updateStatus(String id, JobStatus status) {
    updateStatus(id, status, null, null);
  }

  /**
   * Move a failed or expired job back to {@code queued}, clearing its error and result.
   *
   * <p>The status check and the write are one statement, so of two concurrent calls only one
   * succeeds.
   *
   * @return false if the job is missing or no longer failed or expired
   */
  @Transactional
  public boolean requeue(String id) {
    int updated = jobs.requeue(id, JobStatus.QUEUED, RETRYABLE, now());
    if (updated == 1) {
      LOGGER.debug("Re-queued job: id={}", id);
    }
    return updated == 1;
  }

  /** Current time at the precision the database keeps. */
  public Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  private static boolean isConstraintViolation(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof ConstraintViolationException) {
        return true;
      }
    }
    return false;
  }

  static int clampLimit(int limit) {
    if (limit <= 0) {
      return DEFAULT_LIST_LIMIT;
    }
    return Math.min(limit, MAX_LIST_LIMIT);
  }
}
