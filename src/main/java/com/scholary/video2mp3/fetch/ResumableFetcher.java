package com.scholary.video2mp3.fetch;

import com.scholary.video2mp3.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads media files to local disk, resuming partial downloads.
 *
 * <p>Each attempt looks at what is already on disk and asks for the rest with a {@code Range}
 * header. A {@code 206} reply is appended; a {@code 200} means the server ignored the range and the
 * file is rewritten from the start. A {@code 416} means the partial file no longer matches the
 * remote resource, so it is deleted and the next attempt starts at byte 0.
 *
 * <p>Status codes 5xx and 429 and transport errors are retried with a linear backoff ({@code
 * attempt × backoff}); other statuses fail at once. Interrupting the calling thread aborts the
 * download, including during a backoff.
 */
@Component
public class ResumableFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResumableFetcher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final int BUFFER_SIZE = 64 * 1024;

  private final HttpClient httpClient;
  private final FetchProperties properties;

  public ResumableFetcher(FetchProperties properties) {
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Download {@code url} into {@code dest}.
   *
   * @param url the media URL
   * @param dest target file; an existing file is treated as a partial download
   * @param referer sent as the {@code Referer} header when not blank
   * @param timeout per-request timeout
   * @throws FetchException with the last attempt's error once attempts are exhausted, or at once
   *     for a non-retryable failure
   */
  public void fetch(String url, Path dest, String referer, Duration timeout) {
    if (url == null || url.isBlank()) {
      throw new FetchException("download url is empty", false);
    }
    URI uri = parseUrl(url);

    int maxAttempts = properties.maxAttempts();
    FetchException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        downloadOnce(uri, dest, referer, timeout);
        LOGGER.info("Downloaded {} bytes from {} (attempt {})", Files.size(dest), url, attempt);
        return;
      } catch (FetchException e) {
        last = e;
        if (!e.isRetryable() || attempt == maxAttempts || Thread.currentThread().isInterrupted()) {
          throw e;
        }
        STRUCTURED_LOGGER.logFetchRetry(url, attempt + 1, maxAttempts, e.getMessage());
        sleep(properties.backoff().multipliedBy(attempt));
      } catch (IOException e) {
        throw new FetchException("download failed: " + e.getMessage(), true, e);
      }
    }
    throw last;
  }

  private static URI parseUrl(String url) {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new FetchException("invalid download url: " + e.getMessage(), false, e);
    }
    String scheme = uri.getScheme();
    boolean web = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    if (!web || uri.getHost() == null) {
      throw new FetchException("invalid download url: " + url, false);
    }
    return uri;
  }

  private void downloadOnce(URI url, Path dest, String referer, Duration timeout) {
    long offset = existingSize(dest);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(url)
            .timeout(timeout)
            .header("User-Agent", properties.userAgent())
            .GET();
    if (referer != null && !referer.isBlank()) {
      builder.header("Referer", referer);
    }
    if (offset > 0) {
      builder.header("Range", "bytes=" + offset + "-");
    }

    HttpResponse<InputStream> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    } catch (IOException e) {
      throw new FetchException("download request failed: " + e.getMessage(), true, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("download interrupted", true, e);
    }

    try (InputStream body = response.body()) {
      int status = response.statusCode();
      if (status == 416) {
        deleteQuietly(dest);
        throw new FetchException("download http status 416", true);
      }
      if (status != 200 && status != 206) {
        boolean retryable = status >= 500 || status == 429;
        throw new FetchException("download http status " + status, retryable);
      }

      boolean append = status == 206 && offset > 0;
      LOGGER.debug("Streaming {} to {} (status={}, append={})", url, dest, status, append);
      if (!copy(body, dest, append, append ? offset : 0)) {
        deleteQuietly(dest);
        throw new FetchException(
            "download exceeds max file size of " + properties.maxFileSizeBytes() + " bytes", false);
      }
    } catch (IOException e) {
      throw new FetchException("download interrupted mid-stream: " + e.getMessage(), true, e);
    }
  }

  /** Copy the body into {@code dest}; returns false when the size limit was hit. */
  private boolean copy(InputStream body, Path dest, boolean append, long alreadyWritten)
      throws IOException {
    StandardOpenOption mode =
        append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
    long written = alreadyWritten;
    try (OutputStream out =
        Files.newOutputStream(dest, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode)) {
      byte[] buffer = new byte[BUFFER_SIZE];
      int n;
      while ((n = body.read(buffer)) != -1) {
        written += n;
        if (written > properties.maxFileSizeBytes()) {
          return false;
        }
        out.write(buffer, 0, n);
      }
    }
    return true;
  }

  private static long existingSize(Path dest) {
    try {
      return Files.exists(dest) ? Files.size(dest) : 0;
    } catch (IOException e) {
      return 0;
    }
  }

  private static void deleteQuietly(Path dest) {
    try {
      Files.deleteIfExists(dest);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial download {}: {}", dest, e.getMessage());
    }
  }

  private static void sleep(Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("download interrupted during backoff", true, e);
    }
  }
}
