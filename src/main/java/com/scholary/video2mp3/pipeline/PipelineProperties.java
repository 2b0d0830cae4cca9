package com.scholary.video2mp3.pipeline;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the conversion pipeline.
 *
 * <p>{@code jobTimeout} bounds a single delivery end to end. A job gets {@code maxRetries}
 * redeliveries after the first one, spaced {@code retryBackoff × attempt} apart. Stored error
 * messages are cut to {@code errorMessageMaxLength}, which must fit the {@code error} column.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String tempDir,
    @NotNull Duration jobTimeout,
    @PositiveOrZero int maxRetries,
    @NotNull Duration retryBackoff,
    @Positive int concurrency,
    @Positive int queueCapacity,
    @Positive @Max(1000) int errorMessageMaxLength,
    @Valid @NotNull RecoveryProperties recovery) {

  /** Total deliveries a task may receive, including the first. */
  public int maxAttempts() {
    return maxRetries + 1;
  }

  public record RecoveryProperties(
      boolean enabled, @NotNull Duration interval, @NotNull Duration queuedGrace) {}
}
