package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.ConsolidationResult;
import com.flamingo.ai.memoryengine.service.cache.UserCacheManager;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Tracks detached consolidation tasks and owns the cooperative shutdown signal.
 *
 * <p>Each task is removed from the live set by its completion callback, which also logs failures.
 * Pipelines poll {@link #isShuttingDown()} between stages.
 */
@Component
@Slf4j
public class ConsolidationTaskRegistry {

  private final Executor consolidationExecutor;
  private final UserCacheManager cacheManager;
  private final MeterRegistry meterRegistry;
  private final Duration awaitTimeout;

  private final Set<CompletableFuture<ConsolidationResult>> liveTasks =
      ConcurrentHashMap.newKeySet();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public ConsolidationTaskRegistry(
      @Qualifier("consolidationExecutor") Executor consolidationExecutor,
      UserCacheManager cacheManager,
      MeterRegistry meterRegistry,
      MemoryEngineConfig config) {
    this.consolidationExecutor = consolidationExecutor;
    this.cacheManager = cacheManager;
    this.meterRegistry = meterRegistry;
    this.awaitTimeout = config.getShutdown().getAwaitTimeout();
  }

  /**
   * Starts a background consolidation task.
   *
   * @return the task's future; completes with an empty result when the task could not start
   */
  public CompletableFuture<ConsolidationResult> submit(
      String userId, Supplier<ConsolidationResult> pipeline) {
    if (shuttingDown.get()) {
      log.debug("Shutdown in progress, not starting consolidation for user {}", userId);
      return CompletableFuture.completedFuture(ConsolidationResult.empty());
    }

    CompletableFuture<ConsolidationResult> task;
    try {
      task = CompletableFuture.supplyAsync(pipeline, consolidationExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Consolidation queue full, dropping task for user {}", userId);
      meterRegistry.counter("memory.consolidation.failures").increment();
      return CompletableFuture.completedFuture(ConsolidationResult.empty());
    }

    liveTasks.add(task);
    task.whenComplete(
        (result, error) -> {
          liveTasks.remove(task);
          if (error != null && !task.isCancelled()) {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            log.error(
                "Background memory consolidation failed for user {}: {}",
                userId,
                cause.getMessage(),
                cause);
            meterRegistry.counter("memory.consolidation.failures").increment();
          }
        });
    return task;
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  /** Number of tasks started and not yet completed. */
  public int activeCount() {
    return liveTasks.size();
  }

  /**
   * Raises the shutdown signal, waits for in-flight tasks up to the configured timeout, cancels
   * the rest and drops every cache entry.
   */
  @PreDestroy
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    CompletableFuture<?>[] pending = liveTasks.toArray(new CompletableFuture<?>[0]);
    log.info("Shutting down memory consolidation, {} tasks in flight", pending.length);

    try {
      CompletableFuture.allOf(pending).get(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn(
          "{} consolidation tasks still running after {}ms, cancelling",
          liveTasks.size(),
          awaitTimeout.toMillis());
      liveTasks.forEach(task -> task.cancel(true));
    } catch (ExecutionException e) {
      // Failures were already logged by each task's completion callback.
      log.debug("Consolidation task completed exceptionally during shutdown");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      liveTasks.forEach(task -> task.cancel(true));
    }

    liveTasks.clear();
    cacheManager.clearAll();
  }
}
