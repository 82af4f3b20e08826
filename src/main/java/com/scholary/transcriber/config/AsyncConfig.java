package com.scholary.transcriber.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background execution.
 *
 * <p>Two bounded pools:
 *
 * <ul>
 *   <li>{@code taskExecutor} runs one pipeline per accepted job, off the request thread
 *   <li>{@code chunkExecutor} runs the dispatcher workers that drive whisper processes
 * </ul>
 *
 * <p>Keeping them apart means a pipeline thread waiting on its workers never occupies a slot a
 * worker needs.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "chunkExecutor")
  public Executor chunkExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.chunkExecutorThreads());
    executor.setMaxPoolSize(properties.chunkExecutorThreads());
    executor.setThreadNamePrefix("chunk-worker-");
    executor.initialize();
    return executor;
  }
}
