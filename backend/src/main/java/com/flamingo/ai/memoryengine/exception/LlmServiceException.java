package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when the LLM transport fails. */
public class LlmServiceException extends MemoryEngineException {

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.MODEL_FAILURE;
  }
}
