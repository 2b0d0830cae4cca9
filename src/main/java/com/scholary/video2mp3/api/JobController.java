package com.scholary.video2mp3.api;

import com.scholary.video2mp3.events.JobEventsService;
import com.scholary.video2mp3.job.Job;
import com.scholary.video2mp3.job.JobRepository;
import com.scholary.video2mp3.service.JobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for conversion jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a share link for conversion
 *   <li>Listing and reading jobs, with signed MP3 URLs once ready
 *   <li>Redirecting to the MP3 as a browser download
 *   <li>Retrying failed or expired jobs
 *   <li>Streaming status changes as server-sent events
 * </ul>
 */
@RestController
@RequestMapping("/jobs")
@Tag(name = "Jobs", description = "Video to MP3 conversion jobs")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final JobService jobService;
  private final JobEventsService eventsService;

  public JobController(JobService jobService, JobEventsService eventsService) {
    this.jobService = jobService;
    this.eventsService = eventsService;
  }

  @PostMapping
  @Operation(
      summary = "Submit a video link",
      description =
          "Accepts a link or pasted share text, detects the platform and queues a conversion. "
              + "Returns immediately with the job id.")
  public ResponseEntity<CreateJobResponse> create(@Valid @RequestBody CreateJobRequest request) {
    Job job = jobService.create(request.url());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new CreateJobResponse(job.getId(), job.getStatus()));
  }

  @GetMapping
  @Operation(summary = "List recent jobs", description = "Newest first; limit defaults to 20, max 100")
  public JobListResponse list(@RequestParam(name = "limit", required = false) String limit) {
    List<JobResponse> jobs =
        jobService.list(parseLimit(limit)).stream()
            .map(jobService::toResponse)
            .collect(Collectors.toList());
    return new JobListResponse(jobs);
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get a job", description = "Includes a freshly signed mp3_url when ready")
  public JobResponse get(@PathVariable("id") String id) {
    return jobService.toResponse(jobService.get(id));
  }

  @GetMapping("/{id}/download")
  @Operation(
      summary = "Download the MP3",
      description = "302 to a signed URL that saves the file; 409 while the job is not ready")
  public ResponseEntity<Void> download(@PathVariable("id") String id) {
    String url = jobService.downloadUrl(id);
    LOGGER.debug("Redirecting download: jobId={}", id);
    return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(url)).build();
  }

  @PostMapping("/{id}/retry")
  @Operation(summary = "Retry a job", description = "Only failed or expired jobs; 409 otherwise")
  public ResponseEntity<CreateJobResponse> retry(@PathVariable("id") String id) {
    Job job = jobService.retry(id);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new CreateJobResponse(job.getId(), job.getStatus()));
  }

  @GetMapping("/{id}/events")
  @Operation(
      summary = "Stream job status",
      description =
          "Server-sent events: the current snapshot, then one event per change, "
              + "closing after a terminal status")
  public SseEmitter events(@PathVariable("id") String id) {
    return eventsService.open(id);
  }

  // unparseable limits fall back to the default instead of failing the request
  static int parseLimit(String raw) {
    if (raw == null || raw.isBlank()) {
      return JobRepository.DEFAULT_LIST_LIMIT;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      return JobRepository.DEFAULT_LIST_LIMIT;
    }
  }
}
