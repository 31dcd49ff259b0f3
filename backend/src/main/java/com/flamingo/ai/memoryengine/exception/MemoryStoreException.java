package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when a memory store call fails. */
public class MemoryStoreException extends MemoryEngineException {

  public MemoryStoreException(String message) {
    super(message);
  }

  public MemoryStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.STORE_FAILURE;
  }
}
