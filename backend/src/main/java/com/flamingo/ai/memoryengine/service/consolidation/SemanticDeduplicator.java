package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.OperationKind;
import com.flamingo.ai.memoryengine.domain.model.MemoryOperation;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.service.embedding.EmbeddingService;
import com.flamingo.ai.memoryengine.util.TextUtils;
import com.flamingo.ai.memoryengine.util.VectorMath;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks planned CREATE and UPDATE operations against the memories already stored.
 *
 * <p>A CREATE whose content matches a stored memory is dropped. An UPDATE that matches another
 * memory keeps its enriched content and the matched memory is deleted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticDeduplicator {

  private final EmbeddingService embeddingService;
  private final MemoryEngineConfig config;

  /**
   * Deduplicates the grouped operations in place.
   *
   * @param operationsByKind mutable operation lists per kind; DELETE may gain entries
   * @param currentMemories the user's stored memories
   * @param userId owner of the memories
   */
  public void deduplicate(
      Map<OperationKind, List<MemoryOperation>> operationsByKind,
      List<MemoryRecord> currentMemories,
      String userId) {
    List<MemoryOperation> deletes = operationsByKind.get(OperationKind.DELETE);
    Set<String> deletedIds = new HashSet<>();
    deletes.forEach(op -> deletedIds.add(op.memoryId()));

    List<MemoryOperation> creates = new ArrayList<>();
    for (MemoryOperation create : operationsByKind.get(OperationKind.CREATE)) {
      Optional<String> duplicate = findDuplicate(create.content(), currentMemories, userId);
      if (duplicate.isPresent()) {
        log.info(
            "Skipping duplicate CREATE: {} (matches memory {})",
            preview(create.content()),
            duplicate.get());
        continue;
      }
      creates.add(create);
    }
    operationsByKind.put(OperationKind.CREATE, creates);

    for (MemoryOperation update : operationsByKind.get(OperationKind.UPDATE)) {
      List<MemoryRecord> others =
          currentMemories.stream().filter(m -> !m.id().equals(update.memoryId())).toList();
      Optional<String> duplicate = findDuplicate(update.content(), others, userId);
      if (duplicate.isPresent() && deletedIds.add(duplicate.get())) {
        log.info(
            "UPDATE creates duplicate: keeping enriched content from memory {}, deleting {}",
            update.memoryId(),
            duplicate.get());
        deletes.add(MemoryOperation.delete(duplicate.get()));
      }
    }
  }

  /** Groups operations by kind into mutable lists, keeping plan order within a kind. */
  public static Map<OperationKind, List<MemoryOperation>> group(List<MemoryOperation> operations) {
    Map<OperationKind, List<MemoryOperation>> grouped = new EnumMap<>(OperationKind.class);
    for (OperationKind kind : OperationKind.values()) {
      grouped.put(kind, new ArrayList<>());
    }
    operations.forEach(op -> grouped.get(op.kind()).add(op));
    return grouped;
  }

  /**
   * Finds the first memory whose similarity to {@code content} reaches the dedup threshold.
   * Failures are logged and treated as "no duplicate".
   */
  Optional<String> findDuplicate(String content, List<MemoryRecord> memories, String userId) {
    if (memories.isEmpty() || !embeddingService.isEmbeddable(content)) {
      return Optional.empty();
    }
    try {
      float[] contentEmbedding = embeddingService.embed(userId, content);
      List<float[]> memoryEmbeddings =
          embeddingService.embedAll(userId, memories.stream().map(MemoryRecord::content).toList());
      double threshold = config.getConsolidation().getDedupThreshold();

      for (int i = 0; i < memories.size(); i++) {
        float[] memoryEmbedding = memoryEmbeddings.get(i);
        if (memoryEmbedding == null) {
          continue;
        }
        double similarity = VectorMath.dot(contentEmbedding, memoryEmbedding);
        if (similarity >= threshold) {
          log.info(
              "Semantic duplicate detected: similarity={} with memory {}",
              String.format(Locale.ROOT, "%.3f", similarity),
              memories.get(i).id());
          return Optional.of(memories.get(i).id());
        }
      }
      return Optional.empty();
    } catch (RuntimeException e) {
      log.warn("Semantic duplicate check failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private String preview(String content) {
    return TextUtils.truncate(content, config.getDisplay().getPreviewLength());
  }
}
