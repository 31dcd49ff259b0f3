package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.agent.dto.PlannedOperation;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.OperationKind;
import com.flamingo.ai.memoryengine.domain.model.MemoryOperation;
import com.flamingo.ai.memoryengine.exception.UnsupportedOperationKindException;
import com.flamingo.ai.memoryengine.util.TextUtils;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw LLM operations into a safe plan.
 *
 * <p>The delete-ratio check runs first, on the raw operation count, and rejects the whole plan.
 * Then each operation is validated against the candidate ids and duplicates inside the plan are
 * dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsolidationPlanValidator {

  private final MemoryEngineConfig config;

  /**
   * Validates a plan.
   *
   * @param planned operations as returned by the model
   * @param candidateIds ids of the memories shown to the model
   * @return the surviving operations in plan order
   */
  public ValidatedPlan validate(List<PlannedOperation> planned, Set<String> candidateIds) {
    if (planned.isEmpty()) {
      return ValidatedPlan.empty();
    }

    if (exceedsDeleteRatio(planned)) {
      return ValidatedPlan.rejectedPlan();
    }

    List<MemoryOperation> operations = new ArrayList<>();
    Set<String> seenContents = new HashSet<>();
    Set<String> seenUpdateIds = new HashSet<>();

    for (PlannedOperation raw : planned) {
      MemoryOperation operation = toOperation(raw, candidateIds);
      if (operation == null) {
        continue;
      }

      if (operation.kind() == OperationKind.UPDATE
          && seenUpdateIds.contains(operation.memoryId())) {
        log.info("Skipping duplicate UPDATE for memory {} in LLM response", operation.memoryId());
        continue;
      }

      if (operation.kind() != OperationKind.DELETE) {
        String normalized = TextUtils.normalizeForComparison(operation.content());
        if (!seenContents.add(normalized)) {
          log.info(
              "Skipping duplicate {} in LLM response: {}",
              operation.kind(),
              TextUtils.truncate(operation.content(), config.getDisplay().getPreviewLength()));
          continue;
        }
      }

      if (operation.kind() == OperationKind.UPDATE) {
        seenUpdateIds.add(operation.memoryId());
      }
      operations.add(operation);
    }

    if (operations.isEmpty()) {
      log.info("No valid memory operations planned");
    } else {
      log.info("Planned {} memory operations: {}", operations.size(), describe(operations));
    }
    return ValidatedPlan.accepted(operations);
  }

  private boolean exceedsDeleteRatio(List<PlannedOperation> planned) {
    int total = planned.size();
    long deletes =
        planned.stream()
            .filter(Objects::nonNull)
            .map(PlannedOperation::operation)
            .filter(op -> op != null && "DELETE".equals(op.strip().toUpperCase(Locale.ROOT)))
            .count();
    double ratio = (double) deletes / total;
    MemoryEngineConfig.Consolidation limits = config.getConsolidation();
    if (total >= limits.getMinOpsForRatioCheck() && ratio > limits.getMaxDeleteRatio()) {
      log.warn(
          "Consolidation safety: {}/{} operations are deletions ({}%), rejecting plan",
          deletes,
          total,
          String.format(Locale.ROOT, "%.1f", ratio * 100));
      return true;
    }
    return false;
  }

  private MemoryOperation toOperation(PlannedOperation raw, Set<String> candidateIds) {
    if (raw == null) {
      return null;
    }
    OperationKind kind;
    try {
      kind = OperationKind.parse(raw.operation());
    } catch (UnsupportedOperationKindException e) {
      log.warn("Dropping operation: {}", e.getMessage());
      return null;
    }

    String id = raw.id() == null ? "" : raw.id().strip();
    String content = raw.content() == null ? "" : raw.content().strip();

    return switch (kind) {
      case CREATE -> validateCreate(content);
      case UPDATE -> validateUpdate(id, content, candidateIds);
      case DELETE -> validateDelete(id, candidateIds);
    };
  }

  private MemoryOperation validateCreate(String content) {
    if (content.isEmpty()) {
      log.warn("Dropping CREATE with empty content");
      return null;
    }
    return MemoryOperation.create(content);
  }

  private MemoryOperation validateUpdate(String id, String content, Set<String> candidateIds) {
    if (!candidateIds.contains(id)) {
      log.warn("Dropping UPDATE for unknown memory id '{}'", id);
      return null;
    }
    if (content.isEmpty()) {
      log.warn("Dropping UPDATE for {} with empty content", id);
      return null;
    }
    return MemoryOperation.update(id, content);
  }

  private MemoryOperation validateDelete(String id, Set<String> candidateIds) {
    if (!candidateIds.contains(id)) {
      log.warn("Dropping DELETE for unknown memory id '{}'", id);
      return null;
    }
    return MemoryOperation.delete(id);
  }

  /** e.g. {@code "1 create, 2 updates"}. */
  static String describe(List<MemoryOperation> operations) {
    List<String> parts = new ArrayList<>();
    for (OperationKind kind : OperationKind.values()) {
      long count = operations.stream().filter(op -> op.kind() == kind).count();
      if (count > 0) {
        String noun = kind.name().toLowerCase(Locale.ROOT);
        parts.add(count + " " + noun + (count == 1 ? "" : "s"));
      }
    }
    return String.join(", ", parts);
  }
}
