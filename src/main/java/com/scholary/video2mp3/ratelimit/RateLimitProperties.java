package com.scholary.video2mp3.ratelimit;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for request rate limiting.
 *
 * <p>{@code perMinute} is the number of requests a client may make per {@code window}; zero turns
 * limiting off.
 */
@ConfigurationProperties(prefix = "ratelimit")
@Validated
public record RateLimitProperties(
    @PositiveOrZero int perMinute, @NotNull Duration window, @Positive long maxClients) {}
