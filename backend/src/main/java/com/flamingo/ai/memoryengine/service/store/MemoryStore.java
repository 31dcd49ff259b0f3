package com.flamingo.ai.memoryengine.service.store;

import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import java.util.List;

/**
 * Durable per-user memory storage consumed by the engine.
 *
 * <p>Implementations throw {@link com.flamingo.ai.memoryengine.exception.MemoryStoreException} on
 * failure. Callers wrap every call in {@link OperationTimeouts}.
 */
public interface MemoryStore {

  /** Lists all memories owned by a user, oldest first. */
  List<MemoryRecord> listByUser(String userId);

  /**
   * Stores a new memory.
   *
   * @return the id of the created memory
   */
  String create(String userId, String content);

  /**
   * Replaces the content of a memory owned by {@code userId}.
   *
   * @throws com.flamingo.ai.memoryengine.exception.MemoryNotFoundException if the id is unknown or
   *     belongs to another user
   */
  void update(String memoryId, String userId, String content);

  /**
   * Deletes a memory owned by {@code userId}.
   *
   * @throws com.flamingo.ai.memoryengine.exception.MemoryNotFoundException if the id is unknown or
   *     belongs to another user
   */
  void delete(String memoryId, String userId);
}
