package com.scholary.video2mp3.resolver;

import java.time.Duration;

/** Turns a share link into a direct media URL. */
public interface VideoResolver {

  /**
   * Resolve {@code sourceUrl}.
   *
   * @param sourceUrl the link the job was created with
   * @param timeout upper bound for the whole call
   * @throws ResolutionException if the link cannot be resolved or yields no media URL
   */
  ResolvedMedia resolve(String sourceUrl, Duration timeout);
}
