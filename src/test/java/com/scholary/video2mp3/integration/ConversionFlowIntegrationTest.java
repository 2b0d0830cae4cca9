package com.scholary.video2mp3.integration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.scholary.video2mp3.objectstore.ObjectStoreClient;
import com.scholary.video2mp3.resolver.MediaKind;
import com.scholary.video2mp3.resolver.ResolutionException;
import com.scholary.video2mp3.resolver.ResolvedMedia;
import com.scholary.video2mp3.resolver.VideoResolver;
import com.scholary.video2mp3.transcode.Transcoder;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

/**
 * End-to-end flow through the HTTP API, the job store, the worker pool and the download stage.
 *
 * <p>The job store is an in-memory H2 database migrated by Flyway and media is served by WireMock.
 * The parser, ffmpeg and the object store are mocked.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ConversionFlowIntegrationTest {

  private static final String SOURCE = "https://v.douyin.com/iRNBho6u/";

  @TempDir static Path workDir;

  private static WireMockServer mediaServer;

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private VideoResolver resolver;
  @MockitoBean private Transcoder transcoder;
  @MockitoBean private ObjectStoreClient objectStore;

  @BeforeAll
  static void startMediaServer() {
    mediaServer = new WireMockServer(wireMockConfig().dynamicPort());
    mediaServer.start();
    mediaServer.stubFor(
        get(urlEqualTo("/media/video.mp4"))
            .willReturn(aResponse().withStatus(200).withBody("fake video bytes")));
  }

  @AfterAll
  static void stopMediaServer() {
    mediaServer.stop();
  }

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "spring.datasource.url",
        () -> "jdbc:h2:mem:video2mp3-e2e;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    registry.add("pipeline.temp-dir", () -> workDir.resolve("work").toString());
    registry.add("pipeline.recovery.enabled", () -> "false");
    registry.add("pipeline.retry-backoff", () -> "50ms");
    registry.add("fetch.backoff", () -> "10ms");
  }

  @Test
  void submittedLink_shouldBecomeDownloadableMp3() throws Exception {
    when(resolver.resolve(eq(SOURCE), any()))
        .thenReturn(
            new ResolvedMedia("douyin", mediaServer.baseUrl() + "/media/video.mp4", MediaKind.VIDEO));
    when(transcoder.transcode(any(), any(), any()))
        .thenAnswer(invocation -> Files.writeString(invocation.getArgument(1), "ID3"));
    when(objectStore.put(any(), any(), eq("audio/mpeg"))).thenAnswer(invocation -> invocation.getArgument(0));
    when(objectStore.presignRead(any(), any(), any()))
        .thenAnswer(invocation -> new URL("http://minio:9000/v2m/" + invocation.getArgument(0) + "?sig=1"));

    String jobId = submit("Watch this https://v.douyin.com/iRNBho6u/ now");
    JsonNode job = awaitStatus(jobId, "ready");

    assertThat(job.get("platform").asText()).isEqualTo("douyin");
    assertThat(job.get("mp3_url").asText()).isEqualTo("http://minio:9000/v2m/jobs/" + jobId + ".mp3?sig=1");
    assertThat(job.get("error").isNull()).isTrue();
    mockMvc
        .perform(MockMvcRequestBuilders.get("/jobs/" + jobId + "/download"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "http://minio:9000/v2m/jobs/" + jobId + ".mp3?sig=1"));
    verify(objectStore).presignRead("jobs/" + jobId + ".mp3", Duration.ofMinutes(15), "video2mp3-" + jobId + ".mp3");
    mediaServer.verify(
        getRequestedFor(urlEqualTo("/media/video.mp4")).withHeader("Referer", equalTo(SOURCE)));
    assertThat(workDir.resolve("work").resolve(jobId)).doesNotExist();
  }

  @Test
  void failedJob_shouldBeRetryable() throws Exception {
    String source = "https://b23.tv/a1b2c3";
    when(resolver.resolve(eq(source), any()))
        .thenThrow(new ResolutionException("parser error: 500 unsupported link"))
        .thenReturn(
            new ResolvedMedia("bilibili", mediaServer.baseUrl() + "/media/video.mp4", MediaKind.VIDEO));
    when(transcoder.transcode(any(), any(), any()))
        .thenAnswer(invocation -> Files.writeString(invocation.getArgument(1), "ID3"));
    when(objectStore.put(any(), any(), any())).thenAnswer(invocation -> invocation.getArgument(0));
    when(objectStore.presignRead(any(), any(), any()))
        .thenAnswer(invocation -> new URL("http://minio:9000/v2m/" + invocation.getArgument(0)));

    String jobId = submit(source);
    JsonNode failed = awaitStatus(jobId, "failed");
    assertThat(failed.get("error").asText()).isEqualTo("parser error: 500 unsupported link");

    mockMvc
        .perform(MockMvcRequestBuilders.get("/jobs/" + jobId + "/download"))
        .andExpect(status().isConflict());
    assertThat(retryOnceSettled(jobId)).isEqualTo(202);

    JsonNode ready = awaitStatus(jobId, "ready");
    assertThat(ready.get("platform").asText()).isEqualTo("bilibili");
  }

  @Test
  void unsupportedLink_shouldBeRejected() throws Exception {
    mockMvc
        .perform(
            post("/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://www.youtube.com/watch?v=abc\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void health_shouldReportOk() throws Exception {
    mockMvc
        .perform(MockMvcRequestBuilders.get("/healthz"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  private String submit(String url) throws Exception {
    String body =
        mockMvc
            .perform(
                post("/jobs")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of("url", url))))
            .andExpect(status().isAccepted())
            .andReturn()
            .getResponse()
            .getContentAsString();
    return objectMapper.readTree(body).get("job_id").asText();
  }

  // the failed delivery releases the job just after writing its status; until then retry is 409
  private int retryOnceSettled(String jobId) throws Exception {
    long deadline = System.currentTimeMillis() + 5_000;
    int status;
    do {
      status =
          mockMvc.perform(post("/jobs/" + jobId + "/retry")).andReturn().getResponse().getStatus();
      if (status != 409) {
        return status;
      }
      Thread.sleep(20);
    } while (System.currentTimeMillis() < deadline);
    return status;
  }

  private JsonNode awaitStatus(String jobId, String expected) throws Exception {
    long deadline = System.currentTimeMillis() + 10_000;
    JsonNode job = null;
    while (System.currentTimeMillis() < deadline) {
      String body =
          mockMvc
              .perform(MockMvcRequestBuilders.get("/jobs/" + jobId))
              .andExpect(status().isOk())
              .andReturn()
              .getResponse()
              .getContentAsString();
      job = objectMapper.readTree(body);
      if (expected.equals(job.get("status").asText())) {
        return job;
      }
      Thread.sleep(50);
    }
    throw new AssertionError("job " + jobId + " never reached " + expected + ", last seen " + job);
  }
}
