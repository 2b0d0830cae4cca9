package com.scholary.video2mp3.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the share-link parser API.
 *
 * <p>Sends {@code {"text": sourceUrl}} to {@code {baseUrl}/api/parse} with signed headers and picks
 * the audio URL when the parser offers one, otherwise the video URL.
 *
 * <p>There is no retry here. Every failure, transport errors included, is a {@link
 * ResolutionException} and ends the job.
 */
@Component
public class ParserApiResolver implements VideoResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParserApiResolver.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ParserRequestSigner signer;
  private final Clock clock;
  private final URI endpoint;

  @Autowired
  public ParserApiResolver(ResolverProperties properties, ObjectMapper objectMapper, Clock clock) {
    this(properties, objectMapper, clock, new ParserRequestSigner());
  }

  ParserApiResolver(
      ResolverProperties properties,
      ObjectMapper objectMapper,
      Clock clock,
      ParserRequestSigner signer) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.signer = signer;
    this.endpoint = parseEndpoint(properties.baseUrl());
    this.httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();

    LOGGER.info("Initialized parser client: endpoint={}", endpoint);
  }

  @Override
  public ResolvedMedia resolve(String sourceUrl, Duration timeout) {
    ParserResponse parsed = call(sourceUrl, timeout);

    if (!parsed.succ() || parsed.retcode() != 200) {
      throw new ResolutionException(
          String.format("parser error: %d %s", parsed.retcode(), nullToEmpty(parsed.retdesc())));
    }
    ParserResponse.Data data = parsed.data();
    String audioUrl = data == null ? null : trimToNull(data.audioUrl());
    String videoUrl = data == null ? null : trimToNull(data.videoUrl());
    if (audioUrl == null && videoUrl == null) {
      throw new ResolutionException("parser returned no media url");
    }

    ResolvedMedia media =
        audioUrl != null
            ? new ResolvedMedia(data.platform(), audioUrl, MediaKind.AUDIO)
            : new ResolvedMedia(data.platform(), videoUrl, MediaKind.VIDEO);
    LOGGER.info(
        "Parser resolved: platform={}, kind={}, url={}",
        media.platform(),
        media.kind(),
        media.mediaUrl());
    return media;
  }

  private ParserResponse call(String sourceUrl, Duration timeout) {
    ParserRequestSigner.SignedHeaders headers = signer.sign(clock.millis());
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(endpoint)
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .header("X-Timestamp", headers.timestamp())
              .header("X-GCLT-Text", headers.nonce())
              .header("X-EGCT-Text", headers.encryptedNonce())
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(Map.of("text", sourceUrl))))
              .build();
    } catch (JsonProcessingException e) {
      throw new ResolutionException("Failed to encode parser request", e);
    }

    LOGGER.debug("Sending parse request to {}", endpoint);

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ResolutionException("parser request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ResolutionException("parser request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new ResolutionException("parser http status " + response.statusCode());
    }
    try {
      return objectMapper.readValue(response.body(), ParserResponse.class);
    } catch (JsonProcessingException e) {
      throw new ResolutionException("parser returned malformed response", e);
    }
  }

  private static URI parseEndpoint(String baseUrl) {
    String base = baseUrl.trim();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/api/parse");
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
