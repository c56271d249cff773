package com.scholary.audio.pipeline.config;

import com.scholary.audio.pipeline.logging.MdcTaskDecorator;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the pipeline.
 *
 * <p>Jobs run on a bounded pool with a queue. Stream readers and pumps run on a separate I/O pool
 * that has no queue: those tasks live as long as their process, so queueing one behind another
 * could stall a job forever. When the I/O pool is exhausted the submission fails instead. A small
 * scheduler fires job timeouts.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineJobExecutor")
  public Executor pipelineJobExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.job().executorThreads());
    executor.setMaxPoolSize(properties.job().executorThreads());
    executor.setQueueCapacity(properties.job().executorQueueSize());
    executor.setThreadNamePrefix("pipeline-job-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "pipelineIoExecutor")
  public Executor pipelineIoExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(Math.min(8, properties.job().ioThreads()));
    executor.setMaxPoolSize(properties.job().ioThreads());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("pipeline-io-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "pipelineScheduler")
  public ThreadPoolTaskScheduler pipelineScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("pipeline-timeout-");
    scheduler.initialize();
    return scheduler;
  }
}
