package com.flamingo.ai.memoryengine.domain.model;

/** Tally of one consolidation run. */
public record ConsolidationResult(int created, int updated, int deleted, int failed) {

  public static ConsolidationResult empty() {
    return new ConsolidationResult(0, 0, 0, 0);
  }

  public int applied() {
    return created + updated + deleted;
  }

  public boolean hasChanges() {
    return applied() > 0;
  }
}
