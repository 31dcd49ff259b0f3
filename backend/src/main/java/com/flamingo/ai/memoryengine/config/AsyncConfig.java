package com.flamingo.ai.memoryengine.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for background consolidation, bounded store fan-out and the two lanes of time-limited
 * calls.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs detached consolidation pipelines after the user-visible response is sent. */
  @Bean(name = "consolidationExecutor")
  public Executor consolidationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("memory-consolidation-");
    executor.initialize();
    return executor;
  }

  /**
   * Executes the store mutations of one consolidation plan. The pool size is the fan-out bound for
   * a single operation kind.
   */
  @Bean(name = "memoryOperationExecutor")
  public Executor memoryOperationExecutor(MemoryEngineConfig config) {
    int parallelism = config.getConsolidation().getMaxParallelOperations();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("memory-op-");
    executor.initialize();
    return executor;
  }

  /**
   * Carrier threads for turn-time store reads and reranking calls. Core and max size are equal so
   * the pool grows to full size before anything queues.
   */
  @Bean(name = "memoryIoExecutor")
  public Executor memoryIoExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(16);
    executor.setMaxPoolSize(16);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("memory-io-");
    executor.initialize();
    return executor;
  }

  /** Carrier threads for consolidation LLM calls and store mutations. */
  @Bean(name = "memoryBackgroundIoExecutor")
  public Executor memoryBackgroundIoExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(8);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("memory-bg-io-");
    executor.initialize();
    return executor;
  }
}
