package com.flamingo.ai.memoryengine.exception;

import java.time.Duration;

/** Exception thrown when a store or LLM call exceeds its deadline. */
public class MemoryTimeoutException extends MemoryEngineException {

  private final String operation;
  private final Duration timeout;

  public MemoryTimeoutException(String operation, Duration timeout, Throwable cause) {
    super(operation + " timed out after " + timeout.toMillis() + "ms", cause);
    this.operation = operation;
    this.timeout = timeout;
  }

  public String getOperation() {
    return operation;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.TIMEOUT;
  }
}
