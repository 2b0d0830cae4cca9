package com.scholary.video2mp3.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.video2mp3.api.JobResponse;
import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobNotFoundException;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.service.JobService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@ExtendWith(MockitoExtension.class)
class JobEventsServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final Duration POLL = Duration.ofSeconds(3);
  private static final Duration KEEPALIVE = Duration.ofSeconds(15);

  @Mock private JobService jobService;
  @Mock private TaskScheduler scheduler;
  @Mock private ScheduledFuture<?> poller;
  @Mock private ScheduledFuture<?> keepalive;

  private JobEventsService service;

  @BeforeEach
  void setUp() {
    service =
        new JobEventsService(
            jobService,
            scheduler,
            new StreamProperties(POLL, KEEPALIVE, Duration.ofMinutes(30), 4),
            Clock.fixed(NOW, ZoneOffset.UTC));
    lenient()
        .when(jobService.toResponse(any()))
        .thenAnswer(invocation -> JobResponse.from(invocation.getArgument(0), null));
  }

  @Test
  void open_shouldFailBeforeStreamingUnknownJob() {
    when(jobService.get("nope")).thenThrow(new JobNotFoundException("nope"));

    assertThatThrownBy(() -> service.open("nope")).isInstanceOf(JobNotFoundException.class);
    verifyNoInteractions(scheduler);
  }

  @Test
  void open_shouldNotScheduleAnythingForTerminalJob() {
    when(jobService.get("a")).thenReturn(job(JobStatus.READY, NOW));

    SseEmitter emitter = service.open("a");

    assertThat(emitter.getTimeout()).isEqualTo(Duration.ofMinutes(30).toMillis());
    verifyNoInteractions(scheduler);
  }

  @Test
  void open_shouldPollAndCancelTasksOnceJobFinishes() {
    when(jobService.get("a"))
        .thenReturn(job(JobStatus.QUEUED, NOW), job(JobStatus.FAILED, NOW.plusSeconds(5)));
    doReturn(poller).when(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(POLL)), eq(POLL));
    doReturn(keepalive)
        .when(scheduler)
        .scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(KEEPALIVE)), eq(KEEPALIVE));

    service.open("a");

    ArgumentCaptor<Runnable> pollTask = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).scheduleAtFixedRate(pollTask.capture(), eq(NOW.plus(POLL)), eq(POLL));
    pollTask.getValue().run();

    verify(poller).cancel(false);
    verify(keepalive).cancel(false);
  }

  private static Job job(JobStatus status, Instant updatedAt) {
    return new Job(
        "a",
        "https://v.douyin.com/a/",
        "douyin",
        status,
        status == JobStatus.FAILED ? "boom" : null,
        status == JobStatus.READY ? "jobs/a.mp3" : null,
        NOW,
        updatedAt);
  }
}
