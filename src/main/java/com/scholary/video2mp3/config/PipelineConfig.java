package com.scholary.video2mp3.config;

import com.scholary.video2mp3.fetch.FetchProperties;
import com.scholary.video2mp3.pipeline.PipelineProperties;
import com.scholary.video2mp3.resolver.ResolverProperties;
import com.scholary.video2mp3.transcode.FfmpegProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the conversion pipeline.
 *
 * <p>Enables the pipeline, fetch, resolver and ffmpeg properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  FetchProperties.class,
  ResolverProperties.class,
  FfmpegProperties.class
})
public class PipelineConfig {}
