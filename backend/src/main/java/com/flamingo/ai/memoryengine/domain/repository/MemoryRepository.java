package com.flamingo.ai.memoryengine.domain.repository;

import com.flamingo.ai.memoryengine.domain.entity.Memory;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Memory entities. */
@Repository
public interface MemoryRepository extends JpaRepository<Memory, String> {

  /** Finds all memories of a user, oldest first. */
  List<Memory> findByUserIdOrderByCreatedAtAsc(String userId);

  /** Finds a memory only if it belongs to the given user. */
  Optional<Memory> findByIdAndUserId(String id, String userId);
}
