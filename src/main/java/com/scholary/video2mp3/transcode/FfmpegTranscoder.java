package com.scholary.video2mp3.transcode;

import com.scholary.video2mp3.job.JobErrors;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ffmpeg to strip the video track and encode the audio as MP3.
 *
 * <p>Combined stdout/stderr goes to a log file next to the output and is quoted (truncated) in the
 * exception when ffmpeg fails. The process is killed if it outlives the timeout.
 */
@Component
public class FfmpegTranscoder implements Transcoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  static final int MAX_OUTPUT_CHARS = 800;

  private final FfmpegProperties properties;

  public FfmpegTranscoder(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public Path transcode(Path input, Path output, Duration timeout) {
    List<String> command = command(input, output);
    Path log = output.resolveSibling(output.getFileName() + ".log");
    LOGGER.debug("Running ffmpeg: {}", String.join(" ", command));

    long startTime = System.currentTimeMillis();
    Process process;
    try {
      process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(log.toFile())
              .start();
    } catch (IOException e) {
      throw new TranscodeException("ffmpeg failed to start: " + e.getMessage(), e);
    }

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new TranscodeException("ffmpeg timed out after " + timeout.toSeconds() + "s");
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new TranscodeException("ffmpeg interrupted", e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      String processOutput = readOutput(log);
      throw new TranscodeException(
          processOutput.isEmpty()
              ? "ffmpeg failed: exit code " + exitCode
              : "ffmpeg failed: exit code " + exitCode + ": " + processOutput);
    }
    if (!isNonEmptyFile(output)) {
      throw new TranscodeException("ffmpeg produced no output");
    }

    LOGGER.info(
        "Transcoded {} -> {} in {}ms",
        input.getFileName(),
        output.getFileName(),
        System.currentTimeMillis() - startTime);
    return output;
  }

  List<String> command(Path input, Path output) {
    return List.of(
        properties.binary(),
        "-hide_banner",
        "-loglevel",
        "error",
        "-y",
        "-i",
        input.toString(),
        "-vn",
        "-acodec",
        "libmp3lame",
        "-ar",
        String.valueOf(properties.sampleRate()),
        "-b:a",
        properties.audioBitrate(),
        output.toString());
  }

  private static String readOutput(Path log) {
    try {
      String text = Files.readString(log, StandardCharsets.UTF_8).trim();
      return JobErrors.truncate(text, MAX_OUTPUT_CHARS);
    } catch (IOException e) {
      return "";
    }
  }

  private static boolean isNonEmptyFile(Path path) {
    try {
      return Files.isRegularFile(path) && Files.size(path) > 0;
    } catch (IOException e) {
      return false;
    }
  }
}
