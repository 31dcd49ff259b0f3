package com.flamingo.ai.memoryengine.service.cache;

import java.util.Locale;

/** The working-set data kinds cached per user. */
public enum CacheKind {
  /** Normalized embeddings keyed by the SHA-256 of their text. */
  EMBEDDING,

  /** Full similarity result lists keyed by the hash of the query. */
  RETRIEVAL,

  /** The user's current memory list. */
  MEMORY,

  /** Short-lived classifier verdicts keyed by the hash of the message. */
  VERDICT;

  /** Lower-case label used as the cache key prefix. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
