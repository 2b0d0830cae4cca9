package com.scholary.video2mp3.platform;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Classifies a source URL by platform.
 *
 * <p>Pure function of the URL host; declaration order of {@link Platform} decides ties.
 */
@Component
public class PlatformDetector {

  public Optional<Platform> detect(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    String host;
    try {
      host = new URI(url.trim()).getHost();
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
    if (host == null || host.isEmpty()) {
      return Optional.empty();
    }
    return Arrays.stream(Platform.values()).filter(p -> p.matchesHost(host)).findFirst();
  }
}
