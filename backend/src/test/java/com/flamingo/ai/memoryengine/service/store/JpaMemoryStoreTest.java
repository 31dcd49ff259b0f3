package com.flamingo.ai.memoryengine.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.repository.MemoryRepository;
import com.flamingo.ai.memoryengine.exception.MemoryNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Runs the store against the SQLite database configured for tests. */
@SpringBootTest
class JpaMemoryStoreTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private MemoryStore memoryStore;
  @Autowired private MemoryRepository memoryRepository;

  @BeforeEach
  void setUp() {
    memoryRepository.deleteAll();
  }

  @Test
  @DisplayName("should create memories and list them per user")
  void shouldCreateAndListPerUser() {
    String first = memoryStore.create("alice", "I live in Lisbon");
    memoryStore.create("alice", "I speak Portuguese");
    memoryStore.create("bob", "I live in Oslo");

    List<MemoryRecord> memories = memoryStore.listByUser("alice");

    assertThat(first).isNotBlank();
    assertThat(memories)
        .extracting(MemoryRecord::content)
        .containsExactlyInAnyOrder("I live in Lisbon", "I speak Portuguese");
    assertThat(memories).allSatisfy(memory -> assertThat(memory.createdAt()).isNotNull());
  }

  @Test
  @DisplayName("should update content in place")
  void shouldUpdateContent() {
    String id = memoryStore.create("alice", "I live in Lisbon");

    memoryStore.update(id, "alice", "I live in Porto");

    assertThat(memoryStore.listByUser("alice"))
        .singleElement()
        .satisfies(
            memory -> {
              assertThat(memory.id()).isEqualTo(id);
              assertThat(memory.content()).isEqualTo("I live in Porto");
            });
  }

  @Test
  @DisplayName("should delete a memory")
  void shouldDeleteMemory() {
    String id = memoryStore.create("alice", "I live in Lisbon");

    memoryStore.delete(id, "alice");

    assertThat(memoryStore.listByUser("alice")).isEmpty();
  }

  @Test
  @DisplayName("should not let one user change another user's memory")
  void shouldEnforceOwnership() {
    String id = memoryStore.create("alice", "I live in Lisbon");

    assertThatThrownBy(() -> memoryStore.update(id, "bob", "I live in Oslo"))
        .isInstanceOf(MemoryNotFoundException.class);
    assertThatThrownBy(() -> memoryStore.delete(id, "bob"))
        .isInstanceOf(MemoryNotFoundException.class);
    assertThat(memoryStore.listByUser("alice")).hasSize(1);
  }

  @Test
  @DisplayName("should report a missing memory")
  void shouldReportMissingMemory() {
    assertThatThrownBy(() -> memoryStore.delete("does-not-exist", "alice"))
        .isInstanceOf(MemoryNotFoundException.class);
  }
}
