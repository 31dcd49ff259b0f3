package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when a memory does not exist or belongs to another user. */
public class MemoryNotFoundException extends MemoryStoreException {

  private final String memoryId;
  private final String userId;

  public MemoryNotFoundException(String memoryId, String userId) {
    super("Memory not found with ID: " + memoryId + " for user " + userId);
    this.memoryId = memoryId;
    this.userId = userId;
  }

  public String getMemoryId() {
    return memoryId;
  }

  public String getUserId() {
    return userId;
  }
}
