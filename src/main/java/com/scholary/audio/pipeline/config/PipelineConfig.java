package com.scholary.audio.pipeline.config;

import com.scholary.audio.pipeline.process.ProcessLauncher;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans shared by the pipeline stages.
 *
 * <p>Enables {@link PipelineProperties}, and provides the process launcher and the HTTP client used
 * to fetch intro and outro clips.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  public ProcessLauncher processLauncher() {
    return ProcessLauncher.system();
  }

  @Bean
  public HttpClient clipHttpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(30))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }
}
