package com.scholary.video2mp3.resolver;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParserApiResolverTest {

  private static final String SOURCE = "https://v.douyin.com/iRNBho6u/";
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private WireMockServer server;
  private ParserApiResolver resolver;

  @BeforeEach
  void setUp() {
    server = new WireMockServer(wireMockConfig().dynamicPort());
    server.start();
    Clock clock = Clock.fixed(Instant.ofEpochMilli(1700000000123L), ZoneOffset.UTC);
    ResolverProperties props =
        new ResolverProperties(server.baseUrl() + "/", Duration.ofSeconds(2));
    resolver =
        new ParserApiResolver(
            props, new ObjectMapper(), clock, new ParserRequestSigner(new Random(7)));
  }

  @AfterEach
  void tearDown() {
    server.stop();
  }

  @Test
  void resolve_shouldPreferAudioUrlAndSendSignedHeaders() {
    stubParser(
        200,
        "{\"retcode\":200,\"retdesc\":\"ok\",\"succ\":true,\"data\":{"
            + "\"platform\":\"douyin\",\"video_url\":\"https://cdn.example/v.mp4\","
            + "\"audio_url\":\"https://cdn.example/a.m4a\",\"extra\":1}}");

    ResolvedMedia media = resolver.resolve(SOURCE, TIMEOUT);

    assertThat(media.mediaUrl()).isEqualTo("https://cdn.example/a.m4a");
    assertThat(media.kind()).isEqualTo(MediaKind.AUDIO);
    assertThat(media.platform()).isEqualTo("douyin");
    server.verify(
        postRequestedFor(urlEqualTo("/api/parse"))
            .withHeader("X-Timestamp", equalTo("1700000000123"))
            .withHeader("X-GCLT-Text", matching("[a-zA-Z]{32}"))
            .withHeader("X-EGCT-Text", matching("[a-zA-Z]{32}"))
            .withRequestBody(equalToJson("{\"text\":\"" + SOURCE + "\"}")));
  }

  @Test
  void resolve_shouldFallBackToVideoUrl() {
    stubParser(
        200,
        "{\"retcode\":200,\"succ\":true,\"data\":{\"video_url\":\"https://cdn.example/v.mp4\","
            + "\"audio_url\":\"  \"}}");

    ResolvedMedia media = resolver.resolve(SOURCE, TIMEOUT);

    assertThat(media.mediaUrl()).isEqualTo("https://cdn.example/v.mp4");
    assertThat(media.kind()).isEqualTo(MediaKind.VIDEO);
  }

  @Test
  void resolve_shouldFailOnParserError() {
    stubParser(200, "{\"retcode\":500,\"retdesc\":\"unsupported link\",\"succ\":false}");

    assertThatThrownBy(() -> resolver.resolve(SOURCE, TIMEOUT))
        .isInstanceOf(ResolutionException.class)
        .hasMessage("parser error: 500 unsupported link");
  }

  @Test
  void resolve_shouldFailWhenNoMediaUrl() {
    stubParser(200, "{\"retcode\":200,\"succ\":true,\"data\":{\"title\":\"x\"}}");

    assertThatThrownBy(() -> resolver.resolve(SOURCE, TIMEOUT))
        .isInstanceOf(ResolutionException.class)
        .hasMessage("parser returned no media url");
  }

  @Test
  void resolve_shouldFailOnHttpError() {
    stubParser(502, "bad gateway");

    assertThatThrownBy(() -> resolver.resolve(SOURCE, TIMEOUT))
        .isInstanceOf(ResolutionException.class)
        .hasMessage("parser http status 502");
  }

  @Test
  void resolve_shouldFailOnMalformedBody() {
    stubParser(200, "<html>");

    assertThatThrownBy(() -> resolver.resolve(SOURCE, TIMEOUT))
        .isInstanceOf(ResolutionException.class)
        .hasMessageContaining("malformed");
  }

  private void stubParser(int status, String body) {
    server.stubFor(
        post(urlEqualTo("/api/parse"))
            .willReturn(
                aResponse()
                    .withStatus(status)
                    .withHeader("Content-Type", "application/json")
                    .withBody(body)));
  }
}
