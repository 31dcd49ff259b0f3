package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.domain.model.MemoryOperation;
import java.util.List;

/**
 * Operations that survived validation, or a rejection of the whole plan by the delete-ratio
 * safety check.
 */
public record ValidatedPlan(List<MemoryOperation> operations, boolean rejected) {

  public static ValidatedPlan accepted(List<MemoryOperation> operations) {
    return new ValidatedPlan(List.copyOf(operations), false);
  }

  public static ValidatedPlan rejectedPlan() {
    return new ValidatedPlan(List.of(), true);
  }

  public static ValidatedPlan empty() {
    return new ValidatedPlan(List.of(), false);
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }
}
