package com.scholary.video2mp3.config;

import com.scholary.video2mp3.objectstore.ObjectStoreClient;
import com.scholary.video2mp3.objectstore.ObjectStoreProperties;
import com.scholary.video2mp3.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the S3 client from the "objectstore.*" properties. Its {@code close()} is picked up as
 * the destroy method, so connections are released on shutdown.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
