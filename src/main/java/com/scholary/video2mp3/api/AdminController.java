package com.scholary.video2mp3.api;

import com.scholary.video2mp3.retention.RetentionProperties;
import com.scholary.video2mp3.retention.RetentionSweeper;
import com.scholary.video2mp3.retention.SweepResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operational endpoints. */
@RestController
@RequestMapping("/admin")
@Tag(name = "Admin", description = "Maintenance operations")
public class AdminController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdminController.class);

  private final RetentionSweeper sweeper;
  private final RetentionProperties retentionProperties;
  private final Clock clock;

  public AdminController(
      RetentionSweeper sweeper, RetentionProperties retentionProperties, Clock clock) {
    this.sweeper = sweeper;
    this.retentionProperties = retentionProperties;
    this.clock = clock;
  }

  @PostMapping("/cleanup")
  @Operation(
      summary = "Delete old jobs",
      description =
          "Deletes jobs created more than retention_days ago together with their MP3 objects. "
              + "Falls back to the configured retention when the body omits it.")
  public CleanupResponse cleanup(@RequestBody(required = false) CleanupRequest request) {
    int days =
        request != null && request.retentionDays() != null && request.retentionDays() > 0
            ? request.retentionDays()
            : retentionProperties.days();
    if (days <= 0) {
      throw new InvalidRequestException("retention_days is required");
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(days));
    LOGGER.info("Admin cleanup requested: retentionDays={}, cutoff={}", days, cutoff);
    SweepResult result = sweeper.sweep(cutoff);
    return new CleanupResponse(result.rowsDeleted(), result.blobsDeleted());
  }
}
