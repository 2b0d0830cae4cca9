package com.scholary.video2mp3.events;

import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.service.JobService;
import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Opens server-sent event streams of job snapshots.
 *
 * <p>Each stream is driven by two tasks on the stream scheduler, one polling the job store and one
 * writing keepalive comments. Both are cancelled when the stream closes.
 */
@Service
public class JobEventsService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobEventsService.class);

  private final JobService jobService;
  private final TaskScheduler scheduler;
  private final StreamProperties properties;
  private final Clock clock;

  public JobEventsService(
      JobService jobService,
      @Qualifier("streamTaskScheduler") TaskScheduler scheduler,
      StreamProperties properties,
      Clock clock) {
    this.jobService = jobService;
    this.scheduler = scheduler;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Open a stream for {@code jobId}.
   *
   * @throws com.scholary.video2mp3.job.JobNotFoundException before anything is streamed if the
   *     job does not exist
   */
  public SseEmitter open(String jobId) {
    Job job = jobService.get(jobId);
    SseEmitter emitter = new SseEmitter(properties.timeout().toMillis());
    JobStatusStream stream = new JobStatusStream(jobId, jobService, new SseEmitterSink(emitter));

    emitter.onCompletion(stream::close);
    emitter.onTimeout(stream::close);
    emitter.onError(e -> stream.close());

    if (!stream.start(job)) {
      return emitter;
    }

    ScheduledFuture<?> poller =
        scheduler.scheduleAtFixedRate(
            stream::poll, clock.instant().plus(properties.pollInterval()), properties.pollInterval());
    ScheduledFuture<?> keepalive =
        scheduler.scheduleAtFixedRate(
            stream::keepalive,
            clock.instant().plus(properties.keepaliveInterval()),
            properties.keepaliveInterval());
    stream.onClose(
        () -> {
          poller.cancel(false);
          keepalive.cancel(false);
        });
    LOGGER.debug("Status stream opened: jobId={}", jobId);
    return emitter;
  }
}
