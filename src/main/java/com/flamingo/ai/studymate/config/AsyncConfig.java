package com.flamingo.ai.studymate.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for document indexing, which runs after the upload transaction commits. Pending
 * indexing jobs are drained on shutdown so a document is not left in the pending state.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Value("${app.indexing.core-pool-size:2}")
  private int corePoolSize;

  @Value("${app.indexing.max-pool-size:4}")
  private int maxPoolSize;

  @Value("${app.indexing.queue-capacity:100}")
  private int queueCapacity;

  @Bean(name = "documentIndexingExecutor")
  public Executor documentIndexingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("doc-index-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
