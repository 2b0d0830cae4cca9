package com.scholary.video2mp3.transcode;

import java.nio.file.Path;
import java.time.Duration;

/** Converts a downloaded media file to MP3. */
public interface Transcoder {

  /**
   * Transcode {@code input} into {@code output}.
   *
   * @return the output path
   * @throws TranscodeException if the conversion fails or exceeds {@code timeout}
   */
  Path transcode(Path input, Path output, Duration timeout);
}
