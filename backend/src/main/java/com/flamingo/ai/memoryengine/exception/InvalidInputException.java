package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when text is empty or outside the accepted size window. */
public class InvalidInputException extends MemoryEngineException {

  public InvalidInputException(String message) {
    super(message);
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.INVALID_INPUT;
  }
}
