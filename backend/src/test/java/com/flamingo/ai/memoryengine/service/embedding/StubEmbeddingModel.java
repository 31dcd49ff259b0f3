package com.flamingo.ai.memoryengine.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic in-memory embedding model for tests.
 *
 * <p>Texts registered with {@link #with} get their fixed vector; any other text gets a
 * pseudo-random vector seeded by its hash, so the same text always embeds the same way.
 */
public class StubEmbeddingModel implements EmbeddingModel {

  private final int dimension;
  private final Map<String, float[]> vectors = new HashMap<>();
  private final List<List<String>> batches = new ArrayList<>();
  private RuntimeException failure;

  public StubEmbeddingModel(int dimension) {
    this.dimension = dimension;
  }

  public StubEmbeddingModel with(String text, float... vector) {
    if (vector.length != dimension) {
      throw new IllegalArgumentException("Expected " + dimension + " dimensions");
    }
    vectors.put(text, vector);
    return this;
  }

  /** Makes every following call throw. */
  public StubEmbeddingModel failWith(RuntimeException failure) {
    this.failure = failure;
    return this;
  }

  @Override
  public synchronized Response<List<Embedding>> embedAll(List<TextSegment> segments) {
    if (failure != null) {
      throw failure;
    }
    List<String> texts = segments.stream().map(TextSegment::text).toList();
    batches.add(texts);
    List<Embedding> embeddings = new ArrayList<>(texts.size());
    for (String text : texts) {
      embeddings.add(Embedding.from(vectors.getOrDefault(text, hashed(text))));
    }
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return dimension;
  }

  /** Number of model calls so far. */
  public synchronized int calls() {
    return batches.size();
  }

  /** Total number of texts sent to the model so far. */
  public synchronized int textsEmbedded() {
    return batches.stream().mapToInt(List::size).sum();
  }

  private float[] hashed(String text) {
    Random random = new Random(text.hashCode());
    float[] vector = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      vector[i] = (float) random.nextGaussian();
    }
    return vector;
  }
}
