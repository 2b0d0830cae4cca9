package com.scholary.video2mp3.api;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the HTTP surface.
 *
 * <p>An empty {@code token} leaves the API open. {@code corsAllowedOrigins} may contain {@code *};
 * an empty list disables CORS headers.
 */
@ConfigurationProperties(prefix = "api")
@Validated
public record ApiProperties(String token, List<String> corsAllowedOrigins) {

  public boolean tokenRequired() {
    return token != null && !token.isBlank();
  }

  public List<String> allowedOrigins() {
    return corsAllowedOrigins == null ? List.of() : corsAllowedOrigins;
  }
}
