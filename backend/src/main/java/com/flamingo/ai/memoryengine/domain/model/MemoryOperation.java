package com.flamingo.ai.memoryengine.domain.model;

import com.flamingo.ai.memoryengine.domain.enums.OperationKind;

/**
 * A validated store mutation. {@code memoryId} is empty for CREATE and {@code content} is empty
 * for DELETE.
 */
public record MemoryOperation(OperationKind kind, String memoryId, String content) {

  public MemoryOperation {
    memoryId = memoryId == null ? "" : memoryId;
    content = content == null ? "" : content;
  }

  public static MemoryOperation create(String content) {
    return new MemoryOperation(OperationKind.CREATE, "", content);
  }

  public static MemoryOperation update(String memoryId, String content) {
    return new MemoryOperation(OperationKind.UPDATE, memoryId, content);
  }

  public static MemoryOperation delete(String memoryId) {
    return new MemoryOperation(OperationKind.DELETE, memoryId, "");
  }
}
