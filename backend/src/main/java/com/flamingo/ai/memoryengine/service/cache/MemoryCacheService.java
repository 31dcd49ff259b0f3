package com.flamingo.ai.memoryengine.service.cache;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.service.classifier.ClassificationVerdict;
import com.flamingo.ai.memoryengine.service.embedding.EmbeddingService;
import com.flamingo.ai.memoryengine.service.store.MemoryStore;
import com.flamingo.ai.memoryengine.service.store.OperationTimeouts;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Typed access to the per-user working set kept in {@link UserCacheManager}: the memory list,
 * similarity results per message and classifier verdicts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryCacheService {

  private final UserCacheManager cacheManager;
  private final CacheKeys cacheKeys;
  private final MemoryStore memoryStore;
  private final OperationTimeouts timeouts;
  private final EmbeddingService embeddingService;
  private final MemoryEngineConfig config;
  private final Clock clock;

  private record MemoryList(List<MemoryRecord> memories) {}

  private record SimilarityList(List<SimilarityResult> results) {}

  private record TimedVerdict(ClassificationVerdict verdict, Instant expiresAt) {}

  /** The user's memories, from cache or else loaded from the store and cached. */
  public List<MemoryRecord> memories(String userId) {
    String key = cacheKeys.memoryList(userId);
    Optional<MemoryList> cached = cacheManager.get(userId, CacheKind.MEMORY, key, MemoryList.class);
    if (cached.isPresent()) {
      log.debug("Memory list cache hit for user {}", userId);
      return cached.get().memories();
    }
    List<MemoryRecord> memories = loadFromStore(userId);
    cacheManager.put(userId, CacheKind.MEMORY, key, new MemoryList(memories));
    return memories;
  }

  /** Loads the user's memories from the store, bypassing the cache. */
  public List<MemoryRecord> loadFromStore(String userId) {
    return List.copyOf(timeouts.store("List memories", () -> memoryStore.listByUser(userId)));
  }

  /** Full similarity list computed for this message, if still cached. */
  public Optional<List<SimilarityResult>> similarities(String userId, String message) {
    return cacheManager
        .get(
            userId,
            CacheKind.RETRIEVAL,
            cacheKeys.forMessage(CacheKind.RETRIEVAL, userId, message),
            SimilarityList.class)
        .map(SimilarityList::results);
  }

  public void putSimilarities(String userId, String message, List<SimilarityResult> results) {
    cacheManager.put(
        userId,
        CacheKind.RETRIEVAL,
        cacheKeys.forMessage(CacheKind.RETRIEVAL, userId, message),
        new SimilarityList(List.copyOf(results)));
  }

  /** Verdict stored for this message, if present and not expired. */
  public Optional<ClassificationVerdict> verdict(String userId, String message) {
    Optional<TimedVerdict> cached =
        cacheManager.get(
            userId,
            CacheKind.VERDICT,
            cacheKeys.forMessage(CacheKind.VERDICT, userId, message),
            TimedVerdict.class);
    return cached
        .filter(timed -> Instant.now(clock).isBefore(timed.expiresAt()))
        .map(TimedVerdict::verdict);
  }

  public void putVerdict(String userId, String message, ClassificationVerdict verdict) {
    Instant expiresAt = Instant.now(clock).plus(config.getCache().getVerdictTtl());
    cacheManager.put(
        userId,
        CacheKind.VERDICT,
        cacheKeys.forMessage(CacheKind.VERDICT, userId, message),
        new TimedVerdict(verdict, expiresAt));
  }

  /** Drops every cached entry of the user. */
  public void evict(String userId) {
    int cleared = cacheManager.clearUserCache(userId);
    log.debug("Evicted {} cache entries for user {}", cleared, userId);
  }

  /**
   * Drops stale retrieval and embedding entries after the store changed, then reloads the memory
   * list and re-embeds it so the next retrieval is warm.
   */
  public void refresh(String userId) {
    long start = System.nanoTime();
    int retrievalCleared = cacheManager.clearUserCache(userId, CacheKind.RETRIEVAL);
    int embeddingCleared = cacheManager.clearUserCache(userId, CacheKind.EMBEDDING);
    log.info(
        "Cleared {} retrieval + {} embedding cache entries for user {}",
        retrievalCleared,
        embeddingCleared,
        userId);

    List<MemoryRecord> memories = loadFromStore(userId);
    cacheManager.put(
        userId, CacheKind.MEMORY, cacheKeys.memoryList(userId), new MemoryList(memories));
    if (memories.isEmpty()) {
      log.info("No memories found for user {} after refresh", userId);
      return;
    }

    List<String> contents =
        memories.stream()
            .map(MemoryRecord::content)
            .filter(embeddingService::isEmbeddable)
            .toList();
    if (!contents.isEmpty()) {
      embeddingService.embedAll(userId, contents);
      log.info(
          "Cache updated with {} embeddings for user {} in {}ms",
          contents.size(),
          userId,
          (System.nanoTime() - start) / 1_000_000);
    }
  }
}
