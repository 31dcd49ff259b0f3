package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when LLM output cannot be parsed into the expected structure. */
public class ValidationFailureException extends MemoryEngineException {

  public ValidationFailureException(String message) {
    super(message);
  }

  public ValidationFailureException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.VALIDATION_FAILURE;
  }
}
