package com.flamingo.ai.memoryengine.service.store;

import com.flamingo.ai.memoryengine.domain.entity.Memory;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.repository.MemoryRepository;
import com.flamingo.ai.memoryengine.exception.MemoryNotFoundException;
import com.flamingo.ai.memoryengine.exception.MemoryStoreException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link MemoryStore} backed by the {@code memories} table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaMemoryStore implements MemoryStore {

  private final MemoryRepository memoryRepository;

  @Override
  @Transactional(readOnly = true)
  public List<MemoryRecord> listByUser(String userId) {
    try {
      return memoryRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
          .map(Memory::toRecord)
          .toList();
    } catch (DataAccessException e) {
      throw new MemoryStoreException("Failed to list memories for user " + userId, e);
    }
  }

  @Override
  @Transactional
  public String create(String userId, String content) {
    try {
      Memory saved =
          memoryRepository.save(Memory.builder().userId(userId).content(content).build());
      log.debug("Created memory {} for user {}", saved.getId(), userId);
      return saved.getId();
    } catch (DataAccessException e) {
      throw new MemoryStoreException("Failed to create memory for user " + userId, e);
    }
  }

  @Override
  @Transactional
  public void update(String memoryId, String userId, String content) {
    Memory memory = findOwned(memoryId, userId);
    memory.setContent(content);
    try {
      memoryRepository.save(memory);
    } catch (DataAccessException e) {
      throw new MemoryStoreException("Failed to update memory " + memoryId, e);
    }
    log.debug("Updated memory {} for user {}", memoryId, userId);
  }

  @Override
  @Transactional
  public void delete(String memoryId, String userId) {
    Memory memory = findOwned(memoryId, userId);
    try {
      memoryRepository.delete(memory);
    } catch (DataAccessException e) {
      throw new MemoryStoreException("Failed to delete memory " + memoryId, e);
    }
    log.debug("Deleted memory {} for user {}", memoryId, userId);
  }

  private Memory findOwned(String memoryId, String userId) {
    try {
      return memoryRepository
          .findByIdAndUserId(memoryId, userId)
          .orElseThrow(() -> new MemoryNotFoundException(memoryId, userId));
    } catch (DataAccessException e) {
      throw new MemoryStoreException("Failed to load memory " + memoryId, e);
    }
  }
}
