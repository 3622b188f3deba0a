package com.flamingo.ai.timelineqa.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs engine calls so that the router can enforce per-engine timeouts. */
  @Bean(name = "engineExecutor")
  public AsyncTaskExecutor engineExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("qa-engine-");
    executor.initialize();
    return executor;
  }

  /** Single thread, so index generations form a linear history. */
  @Bean(name = "indexRebuildExecutor")
  public Executor indexRebuildExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(10);
    executor.setThreadNamePrefix("index-rebuild-");
    executor.initialize();
    return executor;
  }
}
