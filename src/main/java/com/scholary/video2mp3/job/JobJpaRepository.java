package com.scholary.video2mp3.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data access to the {@code jobs} table. Callers go through {@link JobRepository}. */
interface JobJpaRepository extends JpaRepository<Job, String> {

  List<Job> findAllByOrderByCreatedAtDesc(Pageable pageable);

  List<Job> findByCreatedAtBeforeOrderByCreatedAtAscIdAsc(Instant cutoff, Pageable pageable);

  List<Job> findByStatusInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
      Collection<JobStatus> statuses, Instant updatedBefore, Pageable pageable);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("delete from Job j where j.createdAt < :cutoff")
  int deleteCreatedBefore(@Param("cutoff") Instant cutoff);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.status = :status, j.error = :error, j.resultRef = :resultRef, "
          + "j.updatedAt = :updatedAt where j.id = :id")
  int updateStatus(
      @Param("id") String id,
      @Param("status") JobStatus status,
      @Param("error") String error,
      @Param("resultRef") String resultRef,
      @Param("updatedAt") Instant updatedAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.status = :queued, j.error = null, j.resultRef = null, "
          + "j.updatedAt = :updatedAt where j.id = :id and j.status in :from")
  int requeue(
      @Param("id") String id,
      @Param("queued") JobStatus queued,
      @Param("from") Collection<JobStatus> from,
      @Param("updatedAt") Instant updatedAt);
}
