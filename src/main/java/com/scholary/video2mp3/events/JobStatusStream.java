package com.scholary.video2mp3.events;

import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobNotFoundException;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.service.JobService;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One observer's view of one job.
 *
 * <p>The current snapshot goes out on {@link #start}. Each {@link #poll} reloads the job and emits
 * it again only if its status changed or {@code updatedAt} moved forward. The stream closes right
 * after emitting a terminal status, when the job disappears, or when the sink fails. Closing never
 * touches the job.
 */
public class JobStatusStream {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStatusStream.class);

  private final String jobId;
  private final JobService jobService;
  private final StatusSink sink;
  private final List<Runnable> closeListeners = new ArrayList<>();

  private JobStatus lastStatus;
  private Instant lastUpdatedAt;
  private boolean closed;

  public JobStatusStream(String jobId, JobService jobService, StatusSink sink) {
    this.jobId = jobId;
    this.jobService = jobService;
    this.sink = sink;
  }

  /** Emit the initial snapshot. Returns false if the stream closed straight away. */
  public synchronized boolean start(Job job) {
    emit(job);
    return !closed;
  }

  public synchronized void poll() {
    if (closed) {
      return;
    }
    Job next;
    try {
      next = jobService.get(jobId);
    } catch (JobNotFoundException e) {
      LOGGER.debug("Job deleted while streaming: jobId={}", jobId);
      close();
      return;
    } catch (RuntimeException e) {
      LOGGER.warn("Status poll failed, will retry: jobId={}, error={}", jobId, e.getMessage());
      return;
    }
    if (next.getStatus() == lastStatus && !next.getUpdatedAt().isAfter(lastUpdatedAt)) {
      return;
    }
    emit(next);
  }

  public synchronized void keepalive() {
    if (closed) {
      return;
    }
    try {
      sink.keepalive();
    } catch (IOException e) {
      close();
    }
  }

  public void close() {
    List<Runnable> listeners;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      listeners = new ArrayList<>(closeListeners);
      closeListeners.clear();
    }
    sink.complete();
    listeners.forEach(Runnable::run);
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /** Run {@code listener} once the stream closes, immediately if it already has. */
  public void onClose(Runnable listener) {
    synchronized (this) {
      if (!closed) {
        closeListeners.add(listener);
        return;
      }
    }
    listener.run();
  }

  private void emit(Job job) {
    try {
      sink.send(jobService.toResponse(job));
    } catch (IOException e) {
      LOGGER.debug("Observer disconnected: jobId={}", jobId);
      close();
      return;
    } catch (RuntimeException e) {
      // signing failed; the next poll emits again because nothing was recorded
      LOGGER.warn("Failed to build snapshot: jobId={}, error={}", jobId, e.getMessage());
      return;
    }
    lastStatus = job.getStatus();
    lastUpdatedAt = job.getUpdatedAt();
    if (job.getStatus().isTerminal()) {
      close();
    }
  }
}
