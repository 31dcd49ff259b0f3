package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.agent.MemoryConsolidationAgent;
import com.flamingo.ai.memoryengine.agent.dto.ConsolidationPlan;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.OperationKind;
import com.flamingo.ai.memoryengine.domain.enums.OperationOutcome;
import com.flamingo.ai.memoryengine.domain.model.ConsolidationResult;
import com.flamingo.ai.memoryengine.domain.model.MemoryOperation;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.exception.ErrorKind;
import com.flamingo.ai.memoryengine.exception.MemoryEngineException;
import com.flamingo.ai.memoryengine.exception.MemoryTimeoutException;
import com.flamingo.ai.memoryengine.service.cache.MemoryCacheService;
import com.flamingo.ai.memoryengine.service.format.MemoryFormatter;
import com.flamingo.ai.memoryengine.service.similarity.SimilarityEngine;
import com.flamingo.ai.memoryengine.service.status.StatusEmitter;
import com.flamingo.ai.memoryengine.service.status.StatusSink;
import com.flamingo.ai.memoryengine.service.store.MemoryStore;
import com.flamingo.ai.memoryengine.service.store.OperationTimeouts;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Implementation of ConsolidationService backed by the consolidation agent and the store. */
@Service
@Slf4j
public class ConsolidationServiceImpl implements ConsolidationService {

  private static final String NO_MEMORIES_NOTE =
      "[]\n\nNote: No existing memories found - "
          + "Focus on extracting new memories from the user message below.";

  private final MemoryConsolidationAgent agent;
  private final MemoryStore memoryStore;
  private final OperationTimeouts timeouts;
  private final SimilarityEngine similarityEngine;
  private final MemoryCacheService memoryCacheService;
  private final ConsolidationPlanValidator planValidator;
  private final SemanticDeduplicator deduplicator;
  private final ConsolidationTaskRegistry taskRegistry;
  private final MemoryFormatter formatter;
  private final MemoryEngineConfig config;
  private final MeterRegistry meterRegistry;
  private final Executor operationExecutor;

  public ConsolidationServiceImpl(
      MemoryConsolidationAgent agent,
      MemoryStore memoryStore,
      OperationTimeouts timeouts,
      SimilarityEngine similarityEngine,
      MemoryCacheService memoryCacheService,
      ConsolidationPlanValidator planValidator,
      SemanticDeduplicator deduplicator,
      ConsolidationTaskRegistry taskRegistry,
      MemoryFormatter formatter,
      MemoryEngineConfig config,
      MeterRegistry meterRegistry,
      @Qualifier("memoryOperationExecutor") Executor operationExecutor) {
    this.agent = agent;
    this.memoryStore = memoryStore;
    this.timeouts = timeouts;
    this.similarityEngine = similarityEngine;
    this.memoryCacheService = memoryCacheService;
    this.planValidator = planValidator;
    this.deduplicator = deduplicator;
    this.taskRegistry = taskRegistry;
    this.formatter = formatter;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.operationExecutor = operationExecutor;
  }

  @Override
  @Timed(value = "memory.consolidation", description = "Time for one consolidation pipeline")
  public ConsolidationResult consolidate(
      String message, String userId, List<SimilarityResult> cachedSimilarities, StatusSink sink) {
    long start = System.nanoTime();
    meterRegistry.counter("memory.consolidation.started").increment();

    if (taskRegistry.isShuttingDown()) {
      return ConsolidationResult.empty();
    }
    List<SimilarityResult> candidates = collectCandidates(message, userId, cachedSimilarities);

    if (taskRegistry.isShuttingDown()) {
      return ConsolidationResult.empty();
    }
    ValidatedPlan plan = generatePlan(message, candidates, sink);

    if (taskRegistry.isShuttingDown() || plan.isEmpty()) {
      return ConsolidationResult.empty();
    }
    ConsolidationResult result = executeOperations(plan.operations(), userId, sink);

    String elapsed = String.format(Locale.ROOT, "%.2f", (System.nanoTime() - start) / 1e9);
    log.info(
        "Memory consolidation complete in {}s for user {}: {} applied, {} failed",
        elapsed,
        userId,
        result.applied(),
        result.failed());

    if (result.applied() > 0 || result.failed() > 0) {
      StatusEmitter.progress(sink, "💾 Memory Consolidation Complete in " + elapsed + "s");
      StatusEmitter.done(sink, summary(result));
    }
    return result;
  }

  @Override
  public List<SimilarityResult> collectCandidates(
      String message, String userId, List<SimilarityResult> cachedSimilarities) {
    if (cachedSimilarities != null && !cachedSimilarities.isEmpty()) {
      List<SimilarityResult> candidates = capCandidates(cachedSimilarities);
      log.info(
          "Found {} candidate memories for consolidation from cached similarities",
          candidates.size());
      return candidates;
    }

    List<MemoryRecord> memories;
    try {
      memories = memoryCacheService.memories(userId);
    } catch (MemoryTimeoutException e) {
      throw e;
    } catch (MemoryEngineException e) {
      log.error("Failed to load memories for consolidation: {}", e.getMessage());
      return List.of();
    }
    if (memories.isEmpty()) {
      log.info("No existing memories found for consolidation");
      return List.of();
    }

    try {
      List<SimilarityResult> candidates =
          capCandidates(similarityEngine.score(userId, message, memories));
      log.info(
          "Found {} candidate memories for consolidation (threshold {})",
          candidates.size(),
          String.format(Locale.ROOT, "%.3f", similarityEngine.consolidationThreshold()));
      return candidates;
    } catch (RuntimeException e) {
      log.error("Failed to compute memory similarities for consolidation: {}", e.getMessage());
      return List.of();
    }
  }

  @Override
  public ValidatedPlan generatePlan(
      String message, List<SimilarityResult> candidates, StatusSink sink) {
    String memoryContext =
        "EXISTING MEMORIES FOR CONSOLIDATION:\n"
            + (candidates.isEmpty() ? NO_MEMORIES_NOTE : formatter.formatForLlm(candidates));

    ConsolidationPlan response;
    try {
      response =
          timeouts.backgroundLlm(
              "Memory consolidation",
              () -> agent.plan(formatter.currentDateTime(), memoryContext, message));
    } catch (RuntimeException e) {
      log.warn("LLM consolidation failed during memory processing: {}", e.getMessage());
      StatusEmitter.done(sink, "⚠️ Memory Consolidation Failed");
      return ValidatedPlan.empty();
    }

    if (response == null) {
      log.warn("LLM consolidation returned no plan");
      return ValidatedPlan.empty();
    }

    Set<String> candidateIds =
        candidates.stream().map(SimilarityResult::memoryId).collect(Collectors.toSet());
    ValidatedPlan plan = planValidator.validate(response.safeOps(), candidateIds);
    if (plan.rejected()) {
      meterRegistry.counter("memory.consolidation.rejected").increment();
    }
    return plan;
  }

  @Override
  public ConsolidationResult executeOperations(
      List<MemoryOperation> operations, String userId, StatusSink sink) {
    if (operations.isEmpty() || userId == null || userId.isBlank()) {
      return ConsolidationResult.empty();
    }

    Map<OperationKind, List<MemoryOperation>> byKind = SemanticDeduplicator.group(operations);

    Map<String, String> contentsForDeletion = new HashMap<>();
    try {
      List<MemoryRecord> current = memoryCacheService.loadFromStore(userId);
      current.forEach(memory -> contentsForDeletion.put(memory.id(), memory.content()));
      if (!byKind.get(OperationKind.CREATE).isEmpty()
          || !byKind.get(OperationKind.UPDATE).isEmpty()) {
        deduplicator.deduplicate(byKind, current, userId);
      }
    } catch (RuntimeException e) {
      log.warn(
          "Semantic deduplication failed, proceeding with original operations: {}",
          e.getMessage());
    }

    if (taskRegistry.isShuttingDown()) {
      log.info("Shutdown in progress, dropping {} planned operations", operations.size());
      return ConsolidationResult.empty();
    }

    int created = 0;
    int updated = 0;
    int deleted = 0;
    int failed = 0;

    for (OperationKind kind : OperationKind.values()) {
      List<MemoryOperation> batch = byKind.get(kind);
      if (batch.isEmpty()) {
        continue;
      }
      if (taskRegistry.isShuttingDown()) {
        log.info("Shutdown in progress, not starting {} batch", kind);
        break;
      }
      List<OperationOutcome> outcomes = executeBatch(batch, userId);
      for (int i = 0; i < batch.size(); i++) {
        MemoryOperation operation = batch.get(i);
        OperationOutcome outcome = outcomes.get(i);
        String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
        meterRegistry.counter("memory.consolidation.operations", "outcome", outcomeTag).increment();
        switch (outcome) {
          case CREATED -> {
            created++;
            StatusEmitter.progress(sink, "📝 Created: " + formatter.preview(operation.content()));
          }
          case UPDATED -> {
            updated++;
            StatusEmitter.progress(sink, "✏️ Updated: " + formatter.preview(operation.content()));
          }
          case DELETED -> {
            deleted++;
            String previous = contentsForDeletion.get(operation.memoryId());
            StatusEmitter.progress(
                sink,
                "🗑️ Deleted: "
                    + (previous != null ? formatter.preview(previous) : operation.memoryId()));
          }
          case FAILED -> {
            failed++;
            StatusEmitter.progress(sink, "❌ Failed " + kind);
          }
          case SKIPPED_EMPTY_CONTENT, SKIPPED_EMPTY_ID, SKIPPED_SHUTDOWN -> {
            // Nothing reached the store.
          }
        }
      }
    }

    ConsolidationResult result = new ConsolidationResult(created, updated, deleted, failed);
    log.info(
        "Memory processing completed {}/{} operations (Created {}, Updated {}, Deleted {}, "
            + "Failed {})",
        result.applied(),
        operations.size(),
        created,
        updated,
        deleted,
        failed);

    if (result.hasChanges() && !taskRegistry.isShuttingDown()) {
      try {
        memoryCacheService.refresh(userId);
      } catch (RuntimeException e) {
        log.error("Failed to refresh cache for user {}: {}", userId, e.getMessage());
      }
      // Shutdown may have cleared the caches while the refresh was running.
      if (taskRegistry.isShuttingDown()) {
        memoryCacheService.evict(userId);
      }
    }
    return result;
  }

  /**
   * Applies one operation to the store. Never throws; failures become {@link
   * OperationOutcome#FAILED}.
   */
  public OperationOutcome executeOperation(MemoryOperation operation, String userId) {
    if (taskRegistry.isShuttingDown()) {
      log.debug("Shutdown in progress, skipping {} operation", operation.kind());
      return OperationOutcome.SKIPPED_SHUTDOWN;
    }
    String id = operation.memoryId().strip();
    String content = operation.content().strip();
    try {
      return switch (operation.kind()) {
        case CREATE -> {
          if (content.isEmpty()) {
            log.warn("Skipping CREATE operation: empty content");
            yield OperationOutcome.SKIPPED_EMPTY_CONTENT;
          }
          timeouts.backgroundStore("Create memory", () -> memoryStore.create(userId, content));
          yield OperationOutcome.CREATED;
        }
        case UPDATE -> {
          if (id.isEmpty()) {
            log.warn("Skipping UPDATE operation: empty ID");
            yield OperationOutcome.SKIPPED_EMPTY_ID;
          }
          if (content.isEmpty()) {
            log.warn("Skipping UPDATE operation for {}: empty content", id);
            yield OperationOutcome.SKIPPED_EMPTY_CONTENT;
          }
          timeouts.backgroundStoreAction(
              "Update memory", () -> memoryStore.update(id, userId, content));
          yield OperationOutcome.UPDATED;
        }
        case DELETE -> {
          if (id.isEmpty()) {
            log.warn("Skipping DELETE operation: empty ID");
            yield OperationOutcome.SKIPPED_EMPTY_ID;
          }
          timeouts.backgroundStoreAction("Delete memory", () -> memoryStore.delete(id, userId));
          yield OperationOutcome.DELETED;
        }
      };
    } catch (RuntimeException e) {
      ErrorKind kind = ErrorKind.of(e);
      log.error("Store operation failed for {} ({}): {}", operation.kind(), kind, e.getMessage());
      meterRegistry.counter("memory.store.errors", "kind", kind.tag()).increment();
      return OperationOutcome.FAILED;
    }
  }

  private List<OperationOutcome> executeBatch(List<MemoryOperation> batch, String userId) {
    List<CompletableFuture<OperationOutcome>> futures = new ArrayList<>(batch.size());
    for (MemoryOperation operation : batch) {
      CompletableFuture<OperationOutcome> future;
      try {
        future =
            CompletableFuture.supplyAsync(
                () -> executeOperation(operation, userId), operationExecutor);
      } catch (RuntimeException e) {
        log.error("Could not schedule {} operation: {}", operation.kind(), e.getMessage());
        future = CompletableFuture.completedFuture(OperationOutcome.FAILED);
      }
      futures.add(future);
    }
    List<OperationOutcome> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<OperationOutcome> future : futures) {
      outcomes.add(future.exceptionally(e -> OperationOutcome.FAILED).join());
    }
    return outcomes;
  }

  private List<SimilarityResult> capCandidates(List<SimilarityResult> similarities) {
    List<SimilarityResult> filtered =
        similarityEngine.filter(similarities, similarityEngine.consolidationThreshold());
    int max = config.getRetrieval().extendedCount();
    return filtered.size() <= max ? filtered : List.copyOf(filtered.subList(0, max));
  }

  /** e.g. {@code "Created 1, Deleted 1 Memories (❌ 1 Failed)"}. */
  static String summary(ConsolidationResult result) {
    List<String> parts = new ArrayList<>();
    if (result.created() > 0) {
      parts.add("Created " + result.created());
    }
    if (result.updated() > 0) {
      parts.add("Updated " + result.updated());
    }
    if (result.deleted() > 0) {
      parts.add("Deleted " + result.deleted());
    }
    StringBuilder sb = new StringBuilder(String.join(", ", parts));
    if (result.applied() > 0) {
      sb.append(result.applied() == 1 ? " Memory" : " Memories");
    }
    if (result.failed() > 0) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append("(❌ ").append(result.failed()).append(" Failed)");
    }
    return sb.toString();
  }
}
