package com.scholary.video2mp3.events;

import com.scholary.video2mp3.api.JobResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes snapshots as SSE data events and keepalives as SSE comments. */
class SseEmitterSink implements StatusSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(SseEmitterSink.class);

  private final SseEmitter emitter;

  SseEmitterSink(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void send(JobResponse snapshot) throws IOException {
    emitter.send(SseEmitter.event().data(snapshot, MediaType.APPLICATION_JSON));
  }

  @Override
  public void keepalive() throws IOException {
    emitter.send(SseEmitter.event().comment("keepalive"));
  }

  @Override
  public void complete() {
    try {
      emitter.complete();
    } catch (IllegalStateException e) {
      LOGGER.debug("Emitter already completed: {}", e.getMessage());
    }
  }
}
