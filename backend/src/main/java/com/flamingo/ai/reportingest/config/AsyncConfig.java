package com.flamingo.ai.reportingest.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /**
   * One task per PDF during folder runs. When the pool and queue are full the submitting thread
   * runs the task itself, which throttles the folder scan instead of rejecting files.
   */
  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor() {
    return callerRunsExecutor(2, 4, 100, "ingest-");
  }

  /** OCR, classification and chart calls, bounded by the collaborator time limiter. */
  @Bean(name = "collaboratorExecutor")
  public Executor collaboratorExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("collab-");
    executor.initialize();
    return executor;
  }

  /**
   * Bounded pool whose overflow runs on the caller. Tasks submitted after shutdown are rejected
   * with {@link RejectedExecutionException} rather than silently dropped.
   */
  public static ThreadPoolTaskExecutor callerRunsExecutor(
      int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setRejectedExecutionHandler(
        (task, pool) -> {
          if (pool.isShutdown()) {
            throw new RejectedExecutionException("Executor " + threadNamePrefix + " is shut down");
          }
          task.run();
        });
    executor.initialize();
    return executor;
  }
}
