package com.scholary.video2mp3.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. {@code publicEndpoint} is the
 * address clients can reach; when set, presigned URLs are signed against it instead of the
 * internal {@code endpoint}.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    String publicEndpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @NotNull Duration urlTtl) {

  /** Endpoint used for signing read URLs. */
  public String signingEndpoint() {
    return publicEndpoint != null && !publicEndpoint.isBlank() ? publicEndpoint : endpoint;
  }
}
