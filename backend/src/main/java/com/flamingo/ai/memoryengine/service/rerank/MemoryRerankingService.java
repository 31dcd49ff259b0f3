package com.flamingo.ai.memoryengine.service.rerank;

import com.flamingo.ai.memoryengine.agent.MemoryRerankingAgent;
import com.flamingo.ai.memoryengine.agent.dto.MemorySelection;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.service.format.MemoryFormatter;
import com.flamingo.ai.memoryengine.service.status.StatusEmitter;
import com.flamingo.ai.memoryengine.service.status.StatusSink;
import com.flamingo.ai.memoryengine.service.store.OperationTimeouts;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Narrows similarity-ranked candidates to the set injected into a response.
 *
 * <p>Small candidate sets are truncated as-is. Larger ones are handed to the LLM, which returns an
 * ordered subset; its order is kept. Any LLM failure falls back to plain truncation. Never touches
 * the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRerankingService {

  private final MemoryRerankingAgent agent;
  private final OperationTimeouts timeouts;
  private final MemoryFormatter formatter;
  private final MemoryEngineConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Selects at most {@code maxReturned} memories.
   *
   * @param query the user message
   * @param candidates candidates sorted by descending relevance
   * @param maxReturned upper bound on the result size
   * @param sink optional status sink
   * @return the selected memories, most relevant first
   */
  @Timed(value = "memory.rerank", description = "Time to select memories for injection")
  public List<SimilarityResult> select(
      String query, List<SimilarityResult> candidates, int maxReturned, StatusSink sink) {
    long start = System.nanoTime();

    if (!shouldUseLlm(candidates.size(), maxReturned)) {
      log.info(
          "Skipping LLM reranking: {} candidates within threshold of {}",
          candidates.size(),
          triggerThreshold(maxReturned));
      List<SimilarityResult> selected = truncate(candidates, maxReturned);
      StatusEmitter.done(sink, "🎯 Semantic Memory Retrieval Complete" + duration(start));
      return selected;
    }

    int extendedCount = config.getRetrieval().extendedCount();
    List<SimilarityResult> llmCandidates = truncate(candidates, extendedCount);
    StatusEmitter.progress(
        sink, "🤖 LLM Analyzing " + llmCandidates.size() + " Memories for Relevance");
    log.info(
        "Using LLM reranking: {} candidates exceed {} threshold",
        candidates.size(),
        triggerThreshold(maxReturned));

    List<SimilarityResult> selected;
    try {
      selected = llmSelect(query, llmCandidates, maxReturned);
      meterRegistry.counter("memory.rerank.llm.invocations").increment();
    } catch (RuntimeException e) {
      log.warn("LLM reranking failed, falling back to similarity order: {}", e.getMessage());
      meterRegistry.counter("memory.rerank.llm.failures").increment();
      selected = truncate(candidates, maxReturned);
      StatusEmitter.done(sink, "🎯 Semantic Memory Retrieval Complete" + duration(start));
      return selected;
    }

    if (selected.isEmpty()) {
      log.info("No relevant memories after LLM analysis");
      StatusEmitter.done(sink, "📭 No Relevant Memories After LLM Analysis");
      return selected;
    }

    log.info("LLM selected {} out of {} candidates", selected.size(), llmCandidates.size());
    StatusEmitter.done(sink, "🎯 LLM Memory Retrieval Complete" + duration(start));
    return selected;
  }

  /** Whether the candidate count is large enough to justify an LLM call. */
  public boolean shouldUseLlm(int candidateCount, int maxReturned) {
    return config.getReranking().isEnabled() && candidateCount > triggerThreshold(maxReturned);
  }

  private int triggerThreshold(int maxReturned) {
    return (int) (maxReturned * config.getReranking().getTriggerMultiplier());
  }

  private List<SimilarityResult> llmSelect(
      String query, List<SimilarityResult> candidates, int maxReturned) {
    MemorySelection selection =
        timeouts.llm(
            "Memory reranking",
            () ->
                agent.select(
                    formatter.currentDateTime(),
                    query,
                    formatter.formatForLlm(candidates),
                    maxReturned));

    Map<String, SimilarityResult> byId =
        candidates.stream()
            .collect(
                Collectors.toMap(
                    SimilarityResult::memoryId, Function.identity(), (first, second) -> first));

    // Model order wins; unknown and repeated ids are dropped.
    Set<String> ids = new LinkedHashSet<>(selection == null ? List.of() : selection.safeIds());
    List<SimilarityResult> selected = new ArrayList<>();
    for (String id : ids) {
      SimilarityResult result = byId.get(id == null ? null : id.strip());
      if (result != null && selected.size() < maxReturned) {
        selected.add(result);
      }
    }
    return selected;
  }

  private static List<SimilarityResult> truncate(List<SimilarityResult> results, int max) {
    return results.size() <= max ? List.copyOf(results) : List.copyOf(results.subList(0, max));
  }

  private static String duration(long startNanos) {
    double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
    return seconds >= 0.01 ? String.format(Locale.ROOT, " in %.2fs", seconds) : "";
  }
}
