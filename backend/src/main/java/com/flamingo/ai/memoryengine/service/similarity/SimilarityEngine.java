package com.flamingo.ai.memoryengine.service.similarity;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.service.embedding.EmbeddingService;
import com.flamingo.ai.memoryengine.util.VectorMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Scores a user's memories against a query by cosine similarity of normalized embeddings. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimilarityEngine {

  private final EmbeddingService embeddingService;
  private final MemoryEngineConfig config;

  /**
   * Scores every memory against the query, most relevant first. Memories too short to embed are
   * left out. Ties keep the input order.
   *
   * @throws com.flamingo.ai.memoryengine.exception.InvalidInputException if the query is too short
   */
  public List<SimilarityResult> score(String userId, String query, List<MemoryRecord> memories) {
    if (memories.isEmpty()) {
      return List.of();
    }
    float[] queryEmbedding = embeddingService.embed(userId, query);
    List<float[]> memoryEmbeddings =
        embeddingService.embedAll(userId, memories.stream().map(MemoryRecord::content).toList());

    List<SimilarityResult> results = new ArrayList<>(memories.size());
    for (int i = 0; i < memories.size(); i++) {
      float[] memoryEmbedding = memoryEmbeddings.get(i);
      if (memoryEmbedding == null) {
        continue;
      }
      double relevance = VectorMath.dot(queryEmbedding, memoryEmbedding);
      results.add(SimilarityResult.of(memories.get(i), relevance));
    }
    results.sort(Comparator.comparingDouble(SimilarityResult::relevance).reversed());
    log.debug("Scored {} of {} memories for user {}", results.size(), memories.size(), userId);
    return results;
  }

  /** Keeps results at or above {@code threshold}, preserving order. */
  public List<SimilarityResult> filter(List<SimilarityResult> results, double threshold) {
    return results.stream().filter(r -> r.relevance() >= threshold).toList();
  }

  /** Threshold for memories injected into a response. */
  public double retrievalThreshold() {
    return config.getRetrieval().getSemanticThreshold();
  }

  /** Relaxed threshold for consolidation candidates: a wider net than retrieval. */
  public double consolidationThreshold() {
    return config.getRetrieval().getSemanticThreshold()
        * config.getRetrieval().getRelaxedThresholdMultiplier();
  }
}
