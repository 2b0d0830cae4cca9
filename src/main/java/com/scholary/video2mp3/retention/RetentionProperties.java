package com.scholary.video2mp3.retention;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job retention.
 *
 * <p>{@code days} is the default horizon for cleanup. The periodic sweep runs only when both
 * {@code days} and {@code cleanupInterval} are set. {@code expireReadyAfter}, when set, also
 * expires ready jobs whose audio is older than that.
 */
@ConfigurationProperties(prefix = "retention")
@Validated
public record RetentionProperties(
    @PositiveOrZero int days, @NotNull Duration cleanupInterval, @NotNull Duration expireReadyAfter) {

  public boolean periodicCleanupEnabled() {
    return days > 0 && isPositive(cleanupInterval);
  }

  public boolean expiryEnabled() {
    return isPositive(expireReadyAfter) && isPositive(cleanupInterval);
  }

  private static boolean isPositive(Duration duration) {
    return !duration.isZero() && !duration.isNegative();
  }
}
