package com.flamingo.ai.memoryengine.exception;

/** Base class for failures raised inside the memory engine. */
public abstract class MemoryEngineException extends RuntimeException {

  protected MemoryEngineException(String message) {
    super(message);
  }

  protected MemoryEngineException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind getKind();
}
