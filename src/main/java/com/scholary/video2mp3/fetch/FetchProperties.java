package com.scholary.video2mp3.fetch;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for media downloads. */
@ConfigurationProperties(prefix = "fetch")
@Validated
public record FetchProperties(
    @Positive int maxAttempts,
    @NotNull Duration backoff,
    @NotBlank String userAgent,
    @NotNull Duration connectTimeout,
    @Positive long maxFileSizeBytes) {}
