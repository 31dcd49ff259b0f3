package com.flamingo.ai.memoryengine.service.cache;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.util.TextUtils;
import org.springframework.stereotype.Component;

/** Builds the cache keys used by the pipeline for each {@link CacheKind}. */
@Component
public class CacheKeys {

  private final int hashPrefixLength;

  public CacheKeys(MemoryEngineConfig config) {
    this.hashPrefixLength = config.getCache().getKeyHashPrefixLength();
  }

  /** Key of the single memory-list entry of a user. */
  public String memoryList(String userId) {
    return CacheKind.MEMORY.label() + "_" + userId;
  }

  /** Key of a per-message entry (retrieval results, verdicts). */
  public String forMessage(CacheKind kind, String userId, String message) {
    String hash = TextUtils.sha256Hex(message);
    return kind.label() + "_" + userId + ":" + hash.substring(0, hashPrefixLength);
  }

  /** Key of an embedding: the full content hash, so distinct texts never collide. */
  public String embedding(String text) {
    return TextUtils.sha256Hex(text);
  }
}
