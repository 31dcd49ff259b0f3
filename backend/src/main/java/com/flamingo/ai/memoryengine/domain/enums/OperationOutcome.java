package com.flamingo.ai.memoryengine.domain.enums;

/** Result of executing one memory operation against the store. */
public enum OperationOutcome {
  CREATED,
  UPDATED,
  DELETED,
  SKIPPED_EMPTY_CONTENT,
  SKIPPED_EMPTY_ID,
  SKIPPED_SHUTDOWN,
  FAILED
}
