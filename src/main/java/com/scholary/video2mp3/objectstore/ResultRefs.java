package com.scholary.video2mp3.objectstore;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps a job's stored result reference to an object key.
 *
 * <p>Current rows hold a bare key such as {@code jobs/<id>.mp3}. Older rows hold the absolute URL
 * the object was uploaded to, either path style ({@code http://host/<bucket>/<key>}) or virtual-host
 * style ({@code http://<bucket>.host/<key>}); those are converted back to the key. Absolute URLs
 * that point anywhere else have no key.
 */
@Component
public class ResultRefs {

  private static final String KEY_PREFIX = "jobs/";
  private static final String KEY_SUFFIX = ".mp3";

  private final String bucket;

  @Autowired
  public ResultRefs(ObjectStoreProperties properties) {
    this(properties.bucket());
  }

  ResultRefs(String bucket) {
    this.bucket = bucket;
  }

  /** Deterministic key a job's audio is uploaded under. */
  public static String jobKey(String jobId) {
    return KEY_PREFIX + jobId + KEY_SUFFIX;
  }

  /** Download filename offered to browsers for a job's audio. */
  public static String downloadFilename(String jobId) {
    return "video2mp3-" + jobId + KEY_SUFFIX;
  }

  public static boolean isAbsoluteUrl(String ref) {
    if (ref == null) {
      return false;
    }
    String trimmed = ref.trim();
    return trimmed.startsWith("http://") || trimmed.startsWith("https://");
  }

  /** Object key for {@code ref}, or empty when it is blank or a foreign absolute URL. */
  public Optional<String> objectKey(String ref) {
    if (ref == null || ref.isBlank()) {
      return Optional.empty();
    }
    String trimmed = ref.trim();
    if (!isAbsoluteUrl(trimmed)) {
      return Optional.of(trimmed);
    }
    return keyFromUrl(trimmed);
  }

  private Optional<String> keyFromUrl(String raw) {
    if (bucket == null || bucket.isBlank()) {
      return Optional.empty();
    }
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
    String host = uri.getHost() == null ? "" : uri.getHost();
    String path = uri.getPath() == null ? "" : uri.getPath();
    if (path.startsWith("/")) {
      path = path.substring(1);
    }
    if (host.startsWith(bucket + ".")) {
      return path.isEmpty() ? Optional.empty() : Optional.of(path);
    }
    int slash = path.indexOf('/');
    if (slash > 0 && path.substring(0, slash).equals(bucket) && slash < path.length() - 1) {
      return Optional.of(path.substring(slash + 1));
    }
    return Optional.empty();
  }
}
