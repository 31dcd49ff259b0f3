package com.flamingo.ai.memoryengine.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.exception.InvalidInputException;
import com.flamingo.ai.memoryengine.exception.ValidationFailureException;
import com.flamingo.ai.memoryengine.service.cache.CacheKeys;
import com.flamingo.ai.memoryengine.service.cache.CacheKind;
import com.flamingo.ai.memoryengine.service.cache.UserCacheManager;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {

  private static final String COFFEE = "I drink black coffee every morning";
  private static final String DOG = "I have a golden retriever named Max";

  private StubEmbeddingModel model;
  private UserCacheManager cacheManager;
  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    MemoryEngineConfig config = new MemoryEngineConfig();
    model = new StubEmbeddingModel(2).with(COFFEE, 3f, 4f).with(DOG, 0f, 2f);
    cacheManager = new UserCacheManager(10, 100);
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = newService(model, config);
  }

  private EmbeddingService newService(EmbeddingModel embeddingModel, MemoryEngineConfig config) {
    return new EmbeddingService(
        embeddingModel, cacheManager, new CacheKeys(config), config, meterRegistry);
  }

  @Nested
  @DisplayName("embed")
  class EmbedTests {

    @Test
    @DisplayName("should return L2-normalized vector")
    void shouldNormalize() {
      float[] vector = embeddingService.embed("alice", COFFEE);

      assertThat(vector[0]).isCloseTo(0.6f, within(1e-6f));
      assertThat(vector[1]).isCloseTo(0.8f, within(1e-6f));
    }

    @Test
    @DisplayName("should serve repeated text from cache")
    void shouldServeRepeatedTextFromCache() {
      embeddingService.embed("alice", COFFEE);
      embeddingService.embed("alice", COFFEE);

      assertThat(model.calls()).isEqualTo(1);
      assertThat(cacheManager.size("alice", CacheKind.EMBEDDING)).isEqualTo(1);
      assertThat(meterRegistry.counter("embedding.cache.hits").count()).isEqualTo(1.0);
      assertThat(meterRegistry.counter("embedding.cache.misses").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep caches separate per user")
    void shouldKeepCachesPerUser() {
      embeddingService.embed("alice", COFFEE);
      embeddingService.embed("bob", COFFEE);

      assertThat(model.calls()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject text shorter than minimum")
    void shouldRejectShortText() {
      assertThatThrownBy(() -> embeddingService.embed("alice", "  short  "))
          .isInstanceOf(InvalidInputException.class);
      assertThat(model.calls()).isZero();
    }
  }

  @Nested
  @DisplayName("embedAll")
  class EmbedAllTests {

    @Test
    @DisplayName("should align results with input and leave short texts null")
    void shouldAlignResults() {
      List<float[]> vectors = embeddingService.embedAll("alice", List.of(COFFEE, "tiny", DOG));

      assertThat(vectors).hasSize(3);
      assertThat(vectors.get(0)).isNotNull();
      assertThat(vectors.get(1)).isNull();
      assertThat(vectors.get(2)).containsExactly(0f, 1f);
      assertThat(model.textsEmbedded()).isEqualTo(2);
    }

    @Test
    @DisplayName("should only send uncached texts to the model")
    void shouldOnlySendUncachedTexts() {
      embeddingService.embed("alice", COFFEE);

      embeddingService.embedAll("alice", List.of(COFFEE, DOG));

      assertThat(model.calls()).isEqualTo(2);
      assertThat(model.textsEmbedded()).isEqualTo(2);
    }

    @Test
    @DisplayName("should not call the model when everything is cached")
    void shouldNotCallModelWhenAllCached() {
      embeddingService.embedAll("alice", List.of(COFFEE, DOG));

      embeddingService.embedAll("alice", List.of(DOG, COFFEE));

      assertThat(model.calls()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("embedUncached")
  class EmbedUncachedTests {

    @Test
    @DisplayName("should not populate any user cache")
    void shouldNotPopulateCache() {
      embeddingService.embedUncached(List.of(COFFEE));

      assertThat(cacheManager.userCount()).isZero();
    }

    @Test
    @DisplayName("should return nothing for empty input without calling the model")
    void shouldHandleEmptyInput() {
      assertThat(embeddingService.embedUncached(List.of())).isEmpty();
      assertThat(model.calls()).isZero();
    }
  }

  @Nested
  @DisplayName("Model validation")
  class ValidationTests {

    @Test
    @DisplayName("should reject vectors whose dimension changes")
    void shouldRejectDimensionChange() {
      EmbeddingModel shifting =
          new EmbeddingModel() {
            private int calls;

            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
              float[] vector = new float[++calls == 1 ? 2 : 3];
              Arrays.fill(vector, 1f);
              return Response.from(List.of(Embedding.from(vector)));
            }
          };
      EmbeddingService service = newService(shifting, new MemoryEngineConfig());

      service.embedUncached(List.of(COFFEE));

      assertThatThrownBy(() -> service.embedUncached(List.of(DOG)))
          .isInstanceOf(ValidationFailureException.class)
          .hasMessageContaining("2 dimensions");
    }

    @Test
    @DisplayName("should reject a response with the wrong number of vectors")
    void shouldRejectWrongCount() {
      EmbeddingModel dropping =
          new EmbeddingModel() {
            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
              return Response.from(List.of());
            }
          };
      EmbeddingService service = newService(dropping, new MemoryEngineConfig());

      assertThatThrownBy(() -> service.embedUncached(List.of(COFFEE, DOG)))
          .isInstanceOf(ValidationFailureException.class);
    }

    @Test
    @DisplayName("should truncate very long texts before embedding")
    void shouldTruncateLongTexts() {
      List<String> seen = new ArrayList<>();
      EmbeddingModel recording =
          new EmbeddingModel() {
            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
              segments.forEach(segment -> seen.add(segment.text()));
              return Response.from(List.of(Embedding.from(new float[] {1f, 0f})));
            }
          };
      EmbeddingService service = newService(recording, new MemoryEngineConfig());

      service.embedUncached(List.of("x".repeat(6000)));

      assertThat(seen.get(0)).hasSize(5000);
    }
  }
}
