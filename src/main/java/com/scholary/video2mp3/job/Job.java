package com.scholary.video2mp3.job;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A video-to-audio conversion job.
 *
 * <p>{@code id}, {@code sourceUrl}, {@code platform} and {@code createdAt} are written once at
 * creation. The mutable fields ({@code status}, {@code error}, {@code resultRef}, {@code updatedAt})
 * are only ever changed through {@link JobRepository#updateStatus}, which rewrites them together.
 */
@Entity
@Table(name = "jobs", indexes = @Index(name = "idx_jobs_created_at", columnList = "created_at"))
public class Job {

  @Id
  @Column(name = "id", nullable = false, updatable = false, length = 36)
  private String id;

  @Column(name = "source_url", nullable = false, updatable = false, length = 2048)
  private String sourceUrl;

  @Column(name = "platform", nullable = false, updatable = false, length = 32)
  private String platform;

  @Convert(converter = JobStatusConverter.class)
  @Column(name = "status", nullable = false, length = 16)
  private JobStatus status;

  @Column(name = "error", length = 1024)
  private String error;

  // Object-store key, or an absolute URL for rows written before keys were stored
  @Column(name = "result_ref", length = 2048)
  private String resultRef;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Job() {}

  public Job(String id, String sourceUrl, String platform, Instant createdAt) {
    this.id = id;
    this.sourceUrl = sourceUrl;
    this.platform = platform;
    this.status = JobStatus.QUEUED;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /** Full-state constructor, for jobs rebuilt outside a persistence context. */
  public Job(
      String id,
      String sourceUrl,
      String platform,
      JobStatus status,
      String error,
      String resultRef,
      Instant createdAt,
      Instant updatedAt) {
    this.id = id;
    this.sourceUrl = sourceUrl;
    this.platform = platform;
    this.status = status;
    this.error = error;
    this.resultRef = resultRef;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  public String getId() {
    return id;
  }

  public String getSourceUrl() {
    return sourceUrl;
  }

  public String getPlatform() {
    return platform;
  }

  public JobStatus getStatus() {
    return status;
  }

  public String getError() {
    return error;
  }

  public String getResultRef() {
    return resultRef;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return "Job[id=" + id + ", platform=" + platform + ", status=" + status + "]";
  }
}
