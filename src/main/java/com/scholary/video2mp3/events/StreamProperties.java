package com.scholary.video2mp3.events;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for live job status streams.
 *
 * <p>{@code timeout} caps how long one stream may stay open; clients reconnect after it. Streams
 * are polled on their own pool of {@code schedulerThreads} threads.
 */
@ConfigurationProperties(prefix = "stream")
@Validated
public record StreamProperties(
    @NotNull Duration pollInterval,
    @NotNull Duration keepaliveInterval,
    @NotNull Duration timeout,
    @Positive int schedulerThreads) {}
