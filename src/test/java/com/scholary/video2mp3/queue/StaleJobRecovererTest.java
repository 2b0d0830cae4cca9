package com.scholary.video2mp3.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobRepository;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.pipeline.PipelineProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class StaleJobRecovererTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private JobRepository jobs;
  @Mock private TaskDispatcher dispatcher;
  @Mock private TaskScheduler scheduler;

  private StaleJobRecoverer recoverer;

  @BeforeEach
  void setUp() {
    recoverer = new StaleJobRecoverer(jobs, dispatcher, properties(true), scheduler);
  }

  @Test
  void recover_shouldRedispatchStaleQueuedJobsNotInFlight() {
    when(jobs.now()).thenReturn(NOW);
    when(jobs.findStale(EnumSet.of(JobStatus.QUEUED), NOW.minus(Duration.ofMinutes(2)), 100))
        .thenReturn(List.of(job("a", JobStatus.QUEUED), job("b", JobStatus.QUEUED)));
    when(dispatcher.isInFlight("a")).thenReturn(false);
    when(dispatcher.isInFlight("b")).thenReturn(true);

    StaleJobRecoverer.RecoveryResult result = recoverer.recover();

    assertThat(result.redispatched()).isEqualTo(1);
    verify(dispatcher).enqueue(new ProcessTask("a", "https://v.douyin.com/a/"));
    verify(dispatcher, never()).enqueue(new ProcessTask("b", "https://v.douyin.com/b/"));
  }

  @Test
  void recover_shouldStopRedispatchingWhenQueueIsFull() {
    when(jobs.now()).thenReturn(NOW);
    when(jobs.findStale(eq(EnumSet.of(JobStatus.QUEUED)), any(), eq(100)))
        .thenReturn(List.of(job("a", JobStatus.QUEUED), job("b", JobStatus.QUEUED)));
    doThrow(new DispatchException("full", null)).when(dispatcher).enqueue(any());

    StaleJobRecoverer.RecoveryResult result = recoverer.recover();

    assertThat(result.redispatched()).isZero();
    verify(dispatcher, times(1)).enqueue(any());
  }

  @Test
  void recover_shouldFailAbandonedActiveJobs() {
    when(jobs.now()).thenReturn(NOW);
    Instant activeCutoff = NOW.minus(Duration.ofMinutes(10)).minus(Duration.ofMinutes(2));
    when(jobs.findStale(
            EnumSet.of(JobStatus.DOWNLOADING, JobStatus.TRANSCODING), activeCutoff, 100))
        .thenReturn(List.of(job("c", JobStatus.DOWNLOADING), job("d", JobStatus.TRANSCODING)));
    when(dispatcher.isInFlight("c")).thenReturn(false);
    when(dispatcher.isInFlight("d")).thenReturn(true);

    StaleJobRecoverer.RecoveryResult result = recoverer.recover();

    assertThat(result.failed()).isEqualTo(1);
    verify(jobs)
        .updateStatus("c", JobStatus.FAILED, StaleJobRecoverer.WORKER_LOST_MESSAGE, null);
    verify(jobs, never()).updateStatus(eq("d"), any(), any(), any());
  }

  @Test
  void start_shouldScheduleOnlyWhenEnabled() {
    recoverer.start();
    verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(1)));

    StaleJobRecoverer disabled =
        new StaleJobRecoverer(jobs, dispatcher, properties(false), scheduler);
    disabled.start();
    verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
    verifyNoInteractions(jobs);
  }

  private static PipelineProperties properties(boolean enabled) {
    return new PipelineProperties(
        "/tmp/video2mp3-test",
        Duration.ofMinutes(10),
        3,
        Duration.ofSeconds(5),
        1,
        100,
        800,
        new PipelineProperties.RecoveryProperties(enabled, Duration.ofMinutes(1), Duration.ofMinutes(2)));
  }

  private static Job job(String id, JobStatus status) {
    return new Job(id, "https://v.douyin.com/" + id + "/", "douyin", status, null, null, NOW, NOW);
  }
}
