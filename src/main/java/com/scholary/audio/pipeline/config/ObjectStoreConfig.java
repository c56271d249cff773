package com.scholary.audio.pipeline.config;

import com.scholary.audio.pipeline.objectstore.ObjectStoreClient;
import com.scholary.audio.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.audio.pipeline.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the ObjectStoreClient bean from the "objectstore.*" properties. */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
