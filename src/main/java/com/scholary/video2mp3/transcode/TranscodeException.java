package com.scholary.video2mp3.transcode;

/** ffmpeg exited non-zero, timed out, or left no output file. */
public class TranscodeException extends RuntimeException {

  public TranscodeException(String message) {
    super(message);
  }

  public TranscodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
