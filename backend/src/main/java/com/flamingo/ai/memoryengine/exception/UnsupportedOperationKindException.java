package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when the LLM proposes an operation other than CREATE, UPDATE or DELETE. */
public class UnsupportedOperationKindException extends MemoryEngineException {

  private final String operation;

  public UnsupportedOperationKindException(String operation) {
    super("Unsupported memory operation: " + operation);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.UNSUPPORTED;
  }
}
