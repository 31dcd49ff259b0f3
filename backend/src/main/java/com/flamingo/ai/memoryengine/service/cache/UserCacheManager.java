package com.flamingo.ai.memoryengine.service.cache;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToIntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded two-level LRU cache: users are evicted least-recently-used once {@code maxUsers} is
 * reached, and within one user each {@link CacheKind} holds at most its configured number of keys.
 *
 * <p>All reads and writes go through a single lock, so cross-user and cross-kind operations never
 * interleave. Every operation is O(1) amortized; {@link LinkedHashMap} provides the recency list at
 * both levels.
 *
 * <p>The cache knows nothing about embeddings or memories; readers name the value type they expect.
 */
@Slf4j
public class UserCacheManager {

  private final int maxUsers;
  private final ToIntFunction<CacheKind> capacityByKind;
  private final ReentrantLock lock = new ReentrantLock();

  // Insertion order; a user is moved to the tail explicitly, only on hits and writes.
  private final LinkedHashMap<String, Map<CacheKind, LinkedHashMap<String, Object>>> caches =
      new LinkedHashMap<>();

  public UserCacheManager(int maxUsers, ToIntFunction<CacheKind> capacityByKind) {
    if (maxUsers <= 0) {
      throw new IllegalArgumentException("maxUsers must be positive: " + maxUsers);
    }
    this.maxUsers = maxUsers;
    this.capacityByKind = capacityByKind;
  }

  /** Creates a cache where every kind shares the same capacity. */
  public UserCacheManager(int maxUsers, int maxEntriesPerKind) {
    this(maxUsers, kind -> maxEntriesPerKind);
    if (maxEntriesPerKind <= 0) {
      throw new IllegalArgumentException(
          "maxEntriesPerKind must be positive: " + maxEntriesPerKind);
    }
  }

  /**
   * Looks up a value and marks both the entry and its user as most recently used.
   *
   * @param type expected value type; an entry of another type counts as a miss
   * @return the cached value, or empty on a miss
   */
  public <T> Optional<T> get(String userId, CacheKind kind, String key, Class<T> type) {
    lock.lock();
    try {
      Map<CacheKind, LinkedHashMap<String, Object>> userCache = caches.get(userId);
      if (userCache == null) {
        return Optional.empty();
      }
      LinkedHashMap<String, Object> kindCache = userCache.get(kind);
      if (kindCache == null) {
        return Optional.empty();
      }
      Object value = kindCache.get(key);
      if (!type.isInstance(value)) {
        return Optional.empty();
      }
      touch(userId, userCache);
      return Optional.of(type.cast(value));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Inserts or overwrites a value, evicting the least-recently-used user and then the
   * least-recently-used key of the kind when either bound would be exceeded.
   */
  public void put(String userId, CacheKind kind, String key, Object value) {
    if (value == null) {
      throw new IllegalArgumentException("Cache values must not be null");
    }
    lock.lock();
    try {
      Map<CacheKind, LinkedHashMap<String, Object>> userCache = caches.get(userId);
      if (userCache == null) {
        if (caches.size() >= maxUsers) {
          evictEldest(caches).ifPresent(evicted -> log.debug("Evicted cache for user {}", evicted));
        }
        userCache = new EnumMap<>(CacheKind.class);
        caches.put(userId, userCache);
      } else {
        touch(userId, userCache);
      }

      LinkedHashMap<String, Object> kindCache =
          userCache.computeIfAbsent(kind, k -> new LinkedHashMap<>(16, 0.75f, true));

      if (!kindCache.containsKey(key) && kindCache.size() >= capacityByKind.applyAsInt(kind)) {
        evictEldest(kindCache)
            .ifPresent(evicted -> log.debug("Evicted {} entry for user {}", kind.label(), userId));
      }
      kindCache.put(key, value);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes one kind (or, when {@code kind} is null, every kind) for a user. A user left with no
   * kinds is removed entirely.
   *
   * @return the number of entries removed
   */
  public int clearUserCache(String userId, CacheKind kind) {
    lock.lock();
    try {
      Map<CacheKind, LinkedHashMap<String, Object>> userCache = caches.get(userId);
      if (userCache == null) {
        return 0;
      }
      if (kind == null) {
        int cleared = userCache.values().stream().mapToInt(Map::size).sum();
        caches.remove(userId);
        return cleared;
      }
      LinkedHashMap<String, Object> kindCache = userCache.remove(kind);
      if (userCache.isEmpty()) {
        caches.remove(userId);
      }
      return kindCache == null ? 0 : kindCache.size();
    } finally {
      lock.unlock();
    }
  }

  /** Removes every kind for a user. */
  public int clearUserCache(String userId) {
    return clearUserCache(userId, null);
  }

  /** Drops every cached entry for every user. */
  public void clearAll() {
    lock.lock();
    try {
      caches.clear();
    } finally {
      lock.unlock();
    }
  }

  /** Number of users that currently hold at least one cache kind. */
  public int userCount() {
    lock.lock();
    try {
      return caches.size();
    } finally {
      lock.unlock();
    }
  }

  /** Number of keys cached for a user and kind; does not affect recency. */
  public int size(String userId, CacheKind kind) {
    lock.lock();
    try {
      Map<CacheKind, LinkedHashMap<String, Object>> userCache = caches.get(userId);
      if (userCache == null) {
        return 0;
      }
      LinkedHashMap<String, Object> kindCache = userCache.get(kind);
      return kindCache == null ? 0 : kindCache.size();
    } finally {
      lock.unlock();
    }
  }

  /** Whether a user is cached; does not affect recency. */
  public boolean containsUser(String userId) {
    lock.lock();
    try {
      return caches.containsKey(userId);
    } finally {
      lock.unlock();
    }
  }

  private void touch(String userId, Map<CacheKind, LinkedHashMap<String, Object>> userCache) {
    caches.remove(userId);
    caches.put(userId, userCache);
  }

  private static <K> Optional<K> evictEldest(LinkedHashMap<K, ?> map) {
    Iterator<K> keys = map.keySet().iterator();
    if (!keys.hasNext()) {
      return Optional.empty();
    }
    K eldest = keys.next();
    keys.remove();
    return Optional.of(eldest);
  }
}
