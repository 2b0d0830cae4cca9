package com.scholary.video2mp3.resolver;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the parser API that turns share links into media URLs.
 *
 * <p>Request timeouts come from the job deadline; only the connect timeout is fixed here.
 */
@ConfigurationProperties(prefix = "resolver")
@Validated
public record ResolverProperties(@NotBlank String baseUrl, @NotNull Duration connectTimeout) {}
