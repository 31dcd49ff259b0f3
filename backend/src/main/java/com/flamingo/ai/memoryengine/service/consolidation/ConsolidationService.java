package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.domain.model.ConsolidationResult;
import com.flamingo.ai.memoryengine.domain.model.MemoryOperation;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.service.status.StatusSink;
import java.util.List;

/** Service turning a user message into applied memory mutations. */
public interface ConsolidationService {

  /**
   * Runs the full pipeline: candidate collection, plan generation, semantic deduplication,
   * execution and cache refresh. Checks the shutdown signal between stages.
   *
   * @param message the user message
   * @param userId the owning user
   * @param cachedSimilarities similarity results from the pre-response hook, or null
   * @param sink optional status sink
   * @return tally of applied operations
   */
  ConsolidationResult consolidate(
      String message, String userId, List<SimilarityResult> cachedSimilarities, StatusSink sink);

  /**
   * Collects candidate memories at the relaxed consolidation threshold, capped at the extended
   * count.
   */
  List<SimilarityResult> collectCandidates(
      String message, String userId, List<SimilarityResult> cachedSimilarities);

  /** Asks the LLM for a plan and validates it. An LLM failure yields an empty plan. */
  ValidatedPlan generatePlan(String message, List<SimilarityResult> candidates, StatusSink sink);

  /** Deduplicates against the store, executes the operations and refreshes the user's cache. */
  ConsolidationResult executeOperations(
      List<MemoryOperation> operations, String userId, StatusSink sink);
}
