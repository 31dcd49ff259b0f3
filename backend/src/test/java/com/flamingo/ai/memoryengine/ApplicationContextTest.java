package com.flamingo.ai.memoryengine;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.memoryengine.service.cache.UserCacheManager;
import com.flamingo.ai.memoryengine.service.classifier.ContentClassifier;
import com.flamingo.ai.memoryengine.service.consolidation.ConsolidationService;
import com.flamingo.ai.memoryengine.service.memory.MemoryPipelineService;
import com.flamingo.ai.memoryengine.service.store.MemoryStore;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The language and embedding models are mocked so
 * the test runs without an API key.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(MemoryPipelineService.class)).isNotNull();
    assertThat(applicationContext.getBean(ConsolidationService.class)).isNotNull();
    assertThat(applicationContext.getBean(ContentClassifier.class)).isNotNull();
    assertThat(applicationContext.getBean(MemoryStore.class)).isNotNull();
    assertThat(applicationContext.getBean(UserCacheManager.class)).isNotNull();
  }
}
