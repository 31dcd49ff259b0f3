package com.flamingo.ai.memoryengine.service.store;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.exception.LlmServiceException;
import com.flamingo.ai.memoryengine.exception.MemoryStoreException;
import com.flamingo.ai.memoryengine.exception.MemoryTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs store and language-model calls under an explicit deadline.
 *
 * <p>Calls made while a turn is in progress run on the {@code memoryIoExecutor}; calls made by
 * detached consolidation run on the {@code memoryBackgroundIoExecutor}, so a backlog of slow
 * consolidation calls never delays turn-time reads. The caller blocks for at most the configured
 * timeout and gets a {@link MemoryTimeoutException} when it is exceeded. Exceptions thrown by the
 * call itself are rethrown unchanged when unchecked.
 */
@Component
@Slf4j
public class OperationTimeouts {

  private final Executor ioExecutor;
  private final Executor backgroundExecutor;
  private final Duration storeTimeout;
  private final Duration llmTimeout;
  private final TimeLimiter storeLimiter;
  private final TimeLimiter llmLimiter;

  @Autowired
  public OperationTimeouts(
      @Qualifier("memoryIoExecutor") Executor ioExecutor,
      @Qualifier("memoryBackgroundIoExecutor") Executor backgroundExecutor,
      MemoryEngineConfig config) {
    this.ioExecutor = ioExecutor;
    this.backgroundExecutor = backgroundExecutor;
    this.storeTimeout = config.getStore().getOperationTimeout();
    this.llmTimeout = config.getConsolidation().getLlmTimeout();
    this.storeLimiter = TimeLimiter.of("memory-store", limiterConfig(storeTimeout));
    this.llmLimiter = TimeLimiter.of("memory-llm", limiterConfig(llmTimeout));
  }

  /** Single executor for both lanes. */
  public OperationTimeouts(Executor executor, MemoryEngineConfig config) {
    this(executor, executor, config);
  }

  /** Runs a turn-time store call that returns a value. */
  public <T> T store(String operation, Supplier<T> call) {
    return execute(
        ioExecutor, storeLimiter, storeTimeout, operation, call, OperationTimeouts::storeFailure);
  }

  /** Runs a turn-time language-model call. */
  public <T> T llm(String operation, Supplier<T> call) {
    return execute(
        ioExecutor, llmLimiter, llmTimeout, operation, call, OperationTimeouts::llmFailure);
  }

  /** Runs a store call on behalf of background consolidation. */
  public <T> T backgroundStore(String operation, Supplier<T> call) {
    return execute(
        backgroundExecutor,
        storeLimiter,
        storeTimeout,
        operation,
        call,
        OperationTimeouts::storeFailure);
  }

  /** Runs a background store call without a result. */
  public void backgroundStoreAction(String operation, Runnable call) {
    backgroundStore(
        operation,
        () -> {
          call.run();
          return null;
        });
  }

  /** Runs a language-model call on behalf of background consolidation. */
  public <T> T backgroundLlm(String operation, Supplier<T> call) {
    return execute(
        backgroundExecutor, llmLimiter, llmTimeout, operation, call, OperationTimeouts::llmFailure);
  }

  private <T> T execute(
      Executor executor,
      TimeLimiter limiter,
      Duration timeout,
      String operation,
      Supplier<T> call,
      BiFunction<String, Exception, RuntimeException> wrapChecked) {
    try {
      return limiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
    } catch (TimeoutException e) {
      log.warn("{} timed out after {}ms", operation, timeout.toMillis());
      throw new MemoryTimeoutException(operation, timeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw wrapChecked.apply(operation, e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw wrapChecked.apply(operation, e);
    }
  }

  private static RuntimeException storeFailure(String operation, Exception cause) {
    return new MemoryStoreException(operation + " failed: " + cause.getMessage(), cause);
  }

  private static RuntimeException llmFailure(String operation, Exception cause) {
    return new LlmServiceException(operation + " failed: " + cause.getMessage(), cause);
  }

  private static TimeLimiterConfig limiterConfig(Duration timeout) {
    return TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build();
  }
}
