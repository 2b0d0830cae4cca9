package com.scholary.video2mp3.events;

import com.scholary.video2mp3.api.JobResponse;
import java.io.IOException;

/** Where a status stream writes. An {@link IOException} means the observer has gone away. */
public interface StatusSink {

  void send(JobResponse snapshot) throws IOException;

  void keepalive() throws IOException;

  void complete();
}
