package com.scholary.video2mp3.config;

import com.scholary.video2mp3.events.StreamProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the status stream properties. */
@Configuration
@EnableConfigurationProperties(StreamProperties.class)
public class StreamConfig {}
