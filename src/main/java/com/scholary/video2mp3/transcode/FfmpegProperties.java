package com.scholary.video2mp3.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg.
 *
 * <p>Output is always MP3 via libmp3lame; only the binary, bitrate and sample rate vary.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary, @NotBlank String audioBitrate, @Positive int sampleRate) {}
