package com.flamingo.ai.memoryengine.domain.model;

import java.time.Instant;

/**
 * Relevance of one memory to a query: the dot product of the two normalized embeddings.
 *
 * @param memoryId the memory id
 * @param content the memory content
 * @param relevance cosine similarity in [-1, 1]
 * @param createdAt creation time, may be null
 * @param updatedAt last update time, may be null
 */
public record SimilarityResult(
    String memoryId, String content, double relevance, Instant createdAt, Instant updatedAt) {

  public static SimilarityResult of(MemoryRecord memory, double relevance) {
    return new SimilarityResult(
        memory.id(), memory.content(), relevance, memory.createdAt(), memory.updatedAt());
  }

  /** The most recent known timestamp, preferring the update time. */
  public Instant notedAt() {
    return updatedAt != null ? updatedAt : createdAt;
  }
}
