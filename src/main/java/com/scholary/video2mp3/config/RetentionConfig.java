package com.scholary.video2mp3.config;

import com.scholary.video2mp3.retention.RetentionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the retention properties. */
@Configuration
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionConfig {}
