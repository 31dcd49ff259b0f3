package com.flamingo.ai.memoryengine.service.classifier;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.service.classifier.ReferenceCategories.ReferenceCategory;
import com.flamingo.ai.memoryengine.service.embedding.EmbeddingService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-wide embeddings of the reference exemplars, computed once on first use and shared
 * read-only by every user.
 *
 * <p>A failed initialization is not cached; the next classification tries again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceEmbeddingTable {

  private final EmbeddingService embeddingService;
  private final MemoryEngineConfig config;

  private final Object initLock = new Object();
  private volatile ReferenceEmbeddings embeddings;

  /**
   * Embedded anchors.
   *
   * @param personal one vector per personal exemplar
   * @param skipCategories vectors per skip category, in declaration order
   */
  public record ReferenceEmbeddings(
      float[][] personal, Map<SkipReason, float[][]> skipCategories) {}

  /**
   * Returns the table, computing it on the first call.
   *
   * @return the embeddings, or empty if they could not be computed
   */
  public Optional<ReferenceEmbeddings> get() {
    ReferenceEmbeddings current = embeddings;
    if (current != null) {
      return Optional.of(current);
    }
    synchronized (initLock) {
      if (embeddings == null) {
        try {
          embeddings = compute();
        } catch (RuntimeException e) {
          log.error("Failed to initialize reference embeddings: {}", e.getMessage());
          return Optional.empty();
        }
      }
      return Optional.of(embeddings);
    }
  }

  public boolean isInitialized() {
    return embeddings != null;
  }

  private ReferenceEmbeddings compute() {
    ReferenceCategory personal = ReferenceCategories.personal();
    List<ReferenceCategory> skipCategories =
        ReferenceCategories.skipCategories(config.getClassifier().getGranularity());

    List<String> texts = new ArrayList<>(personal.exemplars());
    skipCategories.forEach(category -> texts.addAll(category.exemplars()));

    List<float[]> vectors = embeddingService.embedUncached(texts);

    int offset = 0;
    float[][] personalVectors = slice(vectors, offset, personal.exemplars().size());
    offset += personal.exemplars().size();

    Map<SkipReason, float[][]> byCategory = new LinkedHashMap<>();
    for (ReferenceCategory category : skipCategories) {
      byCategory.put(category.reason(), slice(vectors, offset, category.exemplars().size()));
      offset += category.exemplars().size();
    }

    log.info(
        "Reference embeddings initialized: {} personal, {} skip categories ({} exemplars)",
        personalVectors.length,
        byCategory.size(),
        texts.size() - personalVectors.length);
    return new ReferenceEmbeddings(personalVectors, Collections.unmodifiableMap(byCategory));
  }

  private static float[][] slice(List<float[]> vectors, int from, int count) {
    return vectors.subList(from, from + count).toArray(new float[0][]);
  }
}
