package com.flamingo.ai.memoryengine.service.embedding;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.exception.InvalidInputException;
import com.flamingo.ai.memoryengine.exception.ValidationFailureException;
import com.flamingo.ai.memoryengine.service.cache.CacheKeys;
import com.flamingo.ai.memoryengine.service.cache.CacheKind;
import com.flamingo.ai.memoryengine.service.cache.UserCacheManager;
import com.flamingo.ai.memoryengine.util.VectorMath;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates L2-normalized text embeddings.
 *
 * <p>Per-user results are cached in the {@link CacheKind#EMBEDDING} kind under the SHA-256 of the
 * text, so repeated scoring of the same memories costs no model calls. Texts shorter than the
 * configured minimum are never embedded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense CJK text
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final UserCacheManager cacheManager;
  private final CacheKeys cacheKeys;
  private final MemoryEngineConfig config;
  private final MeterRegistry meterRegistry;

  // Fixed by the first embedding the model returns.
  private final AtomicInteger dimension = new AtomicInteger();

  /**
   * Embeds a single text for a user, consulting the cache first.
   *
   * @throws InvalidInputException if the text is shorter than the minimum length
   */
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public float[] embed(String userId, String text) {
    if (!isEmbeddable(text)) {
      throw new InvalidInputException("Text too short for embedding generation");
    }
    float[] vector = embedCached(userId, List.of(text)).get(0);
    log.debug("Query embedding ready for user {}", userId);
    return vector;
  }

  /**
   * Embeds texts for a user in one batch. The result is aligned with the input; entries for texts
   * too short to embed are {@code null}.
   */
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<float[]> embedAll(String userId, List<String> texts) {
    return embedCached(userId, texts);
  }

  /** Embeds texts without touching any user cache. Used for shared reference data. */
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<float[]> embedUncached(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    return callModel(texts);
  }

  /** Whether a text is long enough to be embedded. */
  public boolean isEmbeddable(String text) {
    return text != null && text.strip().length() >= config.getClassifier().getMinChars();
  }

  private List<float[]> embedCached(String userId, List<String> texts) {
    float[][] results = new float[texts.size()][];
    List<String> uncachedTexts = new ArrayList<>();
    List<Integer> uncachedIndices = new ArrayList<>();
    List<String> uncachedKeys = new ArrayList<>();
    int hits = 0;

    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (!isEmbeddable(text)) {
        continue;
      }
      String key = cacheKeys.embedding(text);
      Optional<float[]> cached = cacheManager.get(userId, CacheKind.EMBEDDING, key, float[].class);
      if (cached.isPresent()) {
        results[i] = cached.get();
        hits++;
      } else {
        uncachedTexts.add(text);
        uncachedIndices.add(i);
        uncachedKeys.add(key);
      }
    }

    meterRegistry.counter("embedding.cache.hits").increment(hits);
    meterRegistry.counter("embedding.cache.misses").increment(uncachedTexts.size());

    if (!uncachedTexts.isEmpty()) {
      List<float[]> generated = callModel(uncachedTexts);
      for (int j = 0; j < generated.size(); j++) {
        float[] vector = generated.get(j);
        cacheManager.put(userId, CacheKind.EMBEDDING, uncachedKeys.get(j), vector);
        results[uncachedIndices.get(j)] = vector;
      }
    }

    log.debug(
        "Batch embedding for user {}: {} cached, {} new",
        userId,
        hits,
        uncachedTexts.size());
    return Arrays.asList(results);
  }

  private List<float[]> callModel(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text.length() > MAX_CHARS_PER_EMBEDDING) {
        log.warn(
            "Text {} too long for embedding, truncating from {} chars to {} chars",
            i,
            text.length(),
            MAX_CHARS_PER_EMBEDDING);
        text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
      }
      segments.add(TextSegment.from(text));
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<Embedding> embeddings = response.content();
      if (embeddings == null || embeddings.size() != texts.size()) {
        throw new ValidationFailureException(
            "Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size())
                + " vectors for "
                + texts.size()
                + " texts");
      }
      meterRegistry.counter("embedding.requests.success").increment();

      List<float[]> vectors = new ArrayList<>(embeddings.size());
      for (Embedding embedding : embeddings) {
        float[] raw = embedding.vector();
        checkDimension(raw.length);
        vectors.add(VectorMath.normalize(raw));
      }
      return vectors;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private void checkDimension(int actual) {
    if (dimension.compareAndSet(0, actual)) {
      log.info("Detected embedding dimension: {}", actual);
      return;
    }
    int expected = dimension.get();
    if (expected != actual) {
      throw new ValidationFailureException(
          "Embedding must have " + expected + " dimensions, got " + actual);
    }
  }
}
