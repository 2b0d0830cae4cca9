package com.scholary.video2mp3.pipeline;

import com.scholary.video2mp3.fetch.FetchException;
import com.scholary.video2mp3.fetch.ResumableFetcher;
import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobErrors;
import com.scholary.video2mp3.job.JobNotFoundException;
import com.scholary.video2mp3.job.JobRepository;
import com.scholary.video2mp3.job.JobStatus;
import com.scholary.video2mp3.logging.StructuredLogger;
import com.scholary.video2mp3.objectstore.ObjectStoreClient;
import com.scholary.video2mp3.objectstore.ResultRefs;
import com.scholary.video2mp3.queue.JobProcessingException;
import com.scholary.video2mp3.queue.ProcessTask;
import com.scholary.video2mp3.queue.TaskContext;
import com.scholary.video2mp3.queue.TaskHandler;
import com.scholary.video2mp3.resolver.ResolutionException;
import com.scholary.video2mp3.resolver.ResolvedMedia;
import com.scholary.video2mp3.resolver.VideoResolver;
import com.scholary.video2mp3.transcode.Transcoder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Drives one job through resolve, download, transcode and upload.
 *
 * <p>Each status change is written to the job store before the next stage starts, so observers see
 * the stages in order. All scratch files live in {@code <tempDir>/<jobId>}, which is removed however
 * the delivery ends.
 *
 * <p>Failures are recorded on the job as {@code failed} with a bounded message and then rethrown as
 * {@link JobProcessingException}. Resolution failures are terminal. Download, transcode, upload and
 * store errors are retryable, as is running past the job deadline.
 */
@Component
public class PipelineExecutor implements TaskHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineExecutor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String AUDIO_CONTENT_TYPE = "audio/mpeg";

  private final JobRepository jobs;
  private final VideoResolver resolver;
  private final ResumableFetcher fetcher;
  private final Transcoder transcoder;
  private final ObjectStoreClient objectStore;
  private final PipelineProperties properties;
  private final Clock clock;

  public PipelineExecutor(
      JobRepository jobs,
      VideoResolver resolver,
      ResumableFetcher fetcher,
      Transcoder transcoder,
      ObjectStoreClient objectStore,
      PipelineProperties properties,
      Clock clock) {
    this.jobs = jobs;
    this.resolver = resolver;
    this.fetcher = fetcher;
    this.transcoder = transcoder;
    this.objectStore = objectStore;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void handle(ProcessTask task, TaskContext context) {
    String jobId = task.jobId();
    Job job;
    try {
      job = jobs.get(jobId);
    } catch (JobNotFoundException e) {
      LOGGER.warn("Dropping task for unknown job: jobId={}", jobId);
      return;
    }
    if (job.getStatus() == JobStatus.READY) {
      LOGGER.info("Job already ready, acknowledging duplicate delivery: jobId={}", jobId);
      return;
    }

    StructuredLogger.setJobContext(jobId, job.getPlatform(), task.sourceUrl());
    LOGGER.info(
        "Job start: jobId={}, attempt={}/{}", jobId, context.attempt(), context.maxAttempts());
    long startTime = System.currentTimeMillis();
    Path workspace = Paths.get(properties.tempDir(), jobId);
    String stage = "prepare";
    try {
      Files.createDirectories(workspace);

      stage = "resolve";
      transition(jobId, job.getStatus(), JobStatus.DOWNLOADING);
      ResolvedMedia media = resolver.resolve(task.sourceUrl(), remaining(context));

      stage = "download";
      Path mediaFile = workspace.resolve(jobId + media.kind().extension());
      fetcher.fetch(media.mediaUrl(), mediaFile, task.sourceUrl(), remaining(context));

      stage = "transcode";
      transition(jobId, JobStatus.DOWNLOADING, JobStatus.TRANSCODING);
      Path mp3 =
          transcoder.transcode(mediaFile, workspace.resolve(jobId + ".mp3"), remaining(context));

      stage = "upload";
      String key = objectStore.put(ResultRefs.jobKey(jobId), mp3, AUDIO_CONTENT_TYPE);
      checkDeadline(context);
      jobs.updateStatus(jobId, JobStatus.READY, null, key);
      STRUCTURED_LOGGER.logStageTransition(
          jobId, JobStatus.TRANSCODING.value(), JobStatus.READY.value());
      STRUCTURED_LOGGER.logJobCompleted(jobId, key, System.currentTimeMillis() - startTime);

    } catch (Exception e) {
      throw fail(jobId, stage, context, e);
    } finally {
      deleteWorkspace(workspace);
      StructuredLogger.clearJobContext();
    }
  }

  private void transition(String jobId, JobStatus from, JobStatus to) {
    jobs.updateStatus(jobId, to);
    STRUCTURED_LOGGER.logStageTransition(jobId, from.value(), to.value());
  }

  private JobProcessingException fail(String jobId, String stage, TaskContext context, Exception e) {
    // clear the watchdog's interrupt so the failure can still be written
    boolean interrupted = Thread.interrupted();
    boolean timedOut = interrupted || !clock.instant().isBefore(context.deadline());

    String message;
    boolean retryable;
    if (timedOut) {
      message =
          String.format(
              "job timed out after %ds during %s: %s",
              properties.jobTimeout().toSeconds(), stage, JobErrors.describe(e));
      retryable = true;
    } else {
      message = JobErrors.describe(e);
      retryable = isRetryable(e);
    }
    message = JobErrors.truncate(message, properties.errorMessageMaxLength());

    try {
      jobs.updateStatus(jobId, JobStatus.FAILED, message, null);
    } catch (RuntimeException writeFailure) {
      LOGGER.error("Failed to record job failure: jobId={}", jobId, writeFailure);
      if (writeFailure instanceof JobNotFoundException) {
        retryable = false;
      }
    }
    STRUCTURED_LOGGER.logJobFailed(jobId, stage, retryable, message);
    LOGGER.debug("Failure cause for job {}", jobId, e);
    return new JobProcessingException(message, retryable, e);
  }

  static boolean isRetryable(Exception e) {
    if (e instanceof ResolutionException || e instanceof JobNotFoundException) {
      return false;
    }
    if (e instanceof FetchException) {
      return ((FetchException) e).isRetryable();
    }
    return true;
  }

  private Duration remaining(TaskContext context) {
    checkDeadline(context);
    return context.remaining(clock);
  }

  private void checkDeadline(TaskContext context) {
    Duration left = context.remaining(clock);
    if (left.isNegative() || left.isZero()) {
      throw new IllegalStateException("job deadline exceeded");
    }
  }

  private static void deleteWorkspace(Path workspace) {
    try {
      FileSystemUtils.deleteRecursively(workspace);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete workspace {}: {}", workspace, e.getMessage());
    }
  }
}
