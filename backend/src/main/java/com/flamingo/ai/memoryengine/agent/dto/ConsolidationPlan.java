package com.flamingo.ai.memoryengine.agent.dto;

import java.util.List;

/** Structured JSON output from MemoryConsolidationAgent. */
public record ConsolidationPlan(List<PlannedOperation> ops) {

  public List<PlannedOperation> safeOps() {
    return ops == null ? List.of() : ops;
  }
}
